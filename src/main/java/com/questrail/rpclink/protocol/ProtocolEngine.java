package com.questrail.rpclink.protocol;

import com.questrail.rpclink.transport.Frame;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * ProtocolEngine
 * =============================================================================
 * The remote-call protocol as seen by the connection supervisor.
 *
 * <p>The supervisor never looks inside frames. It only:</p>
 * <ul>
 *   <li>gates outbound traffic with {@link #pause()} / {@link #resume()}</li>
 *   <li>hands inbound frames to {@link #receive(Frame)}</li>
 *   <li>forwards frames emitted through {@link ProtocolEngineListener#onOutboundFrame(Frame)}</li>
 *   <li>asks for liveness probes through {@link #probe(Duration)}</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * All methods are invoked from the link's serialized execution context.
 * Engines that complete futures from their own timers must re-enter that
 * context before doing so.
 */
public interface ProtocolEngine
{
    /**
     * Register the listener that receives outbound frames and engine failures.
     * Called once, before any other method.
     */
    void bind(ProtocolEngineListener listener);

    /**
     * Stop emitting outbound frames. Frames produced while paused are queued in
     * order and emitted on {@link #resume()}.
     */
    void pause();

    /**
     * Resume emission, flushing queued frames first.
     */
    void resume();

    boolean isPaused();

    /**
     * Consume one inbound frame. Malformed frames are reported through
     * {@link ProtocolEngineListener#onProtocolError(Throwable)}, not thrown.
     */
    void receive(Frame frame);

    /**
     * Perform one liveness round-trip with the peer.
     *
     * @param timeout maximum time to wait for the answer
     * @return a future completing with the measured round-trip delay, or
     *         exceptionally on timeout or remote error
     */
    CompletableFuture<Duration> probe(Duration timeout);
}
