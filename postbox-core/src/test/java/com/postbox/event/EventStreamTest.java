package com.postbox.event;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventStreamTest {

    @Mock
    private Consumer<String> first;

    @Mock
    private Consumer<String> second;

    @Test
    void testEmitReachesEverySubscriber() {
        EventStream<String> stream = new EventStream<>();
        stream.subscribe(first);
        stream.subscribe(second);

        stream.emit("boom");

        InOrder order = inOrder(first, second);
        order.verify(first).accept("boom");
        order.verify(second).accept("boom");
    }

    @Test
    void testEmitWithoutSubscribersIsNoOp() {
        EventStream<String> stream = new EventStream<>();
        assertDoesNotThrow(() -> stream.emit("ignored"));
        assertEquals(0, stream.subscriberCount());
    }

    @Test
    void testUnsubscribeStopsDelivery() {
        EventStream<String> stream = new EventStream<>();
        Subscription subscription = stream.subscribe(first);
        stream.emit("one");

        subscription.unsubscribe();
        stream.emit("two");

        verify(first, times(1)).accept("one");
        verify(first, never()).accept("two");
        assertEquals(0, stream.subscriberCount());
    }

    @Test
    void testSameObserverSubscribedTwiceIsCalledTwice() {
        EventStream<String> stream = new EventStream<>();
        Subscription one = stream.subscribe(first);
        stream.subscribe(first);

        stream.emit("x");
        verify(first, times(2)).accept("x");

        one.close();
        stream.emit("y");
        verify(first, times(1)).accept("y");
    }

    @Test
    void testObserverFailurePropagatesToEmitter() {
        EventStream<String> stream = new EventStream<>();
        doThrow(new IllegalStateException("observer failed")).when(first).accept("x");
        stream.subscribe(first);
        stream.subscribe(second);

        assertThrows(IllegalStateException.class, () -> stream.emit("x"));
        verifyNoInteractions(second);
    }

    @Test
    void testObserverMayUnsubscribeDuringEmit() {
        EventStream<String> stream = new EventStream<>();
        Subscription[] self = new Subscription[1];
        self[0] = stream.subscribe(value -> self[0].unsubscribe());
        stream.subscribe(second);

        stream.emit("x");
        stream.emit("y");

        verify(second).accept("x");
        verify(second).accept("y");
        assertEquals(1, stream.subscriberCount());
    }
}
