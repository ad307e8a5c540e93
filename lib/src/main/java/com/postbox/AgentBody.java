package com.postbox;

/**
 * The code an agent runs on its worker thread.
 * <p>
 * A body usually loops on {@link Agent#receive()} until the agent is stopped, at which point
 * {@code receive()} throws a cancellation exception that ends the loop:
 * <pre>{@code
 * AgentBody<Command> body = agent -> {
 *     while (true) {
 *         Command command = agent.receive();
 *         ...
 *     }
 * };
 * }</pre>
 *
 * @param <T> The type of messages the agent accepts
 */
@FunctionalInterface
public interface AgentBody<T> {

    /**
     * Runs the agent's logic.
     *
     * @param agent the agent running this body
     * @throws Exception any failure, reported on {@link Agent#errors()}
     */
    void run(Agent<T> agent) throws Exception;
}
