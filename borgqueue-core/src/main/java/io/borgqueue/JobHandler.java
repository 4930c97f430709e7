package io.borgqueue;

/**
 * Executes one job type.
 *
 * <p>The stored payload map is converted into {@link #payloadClass()} once, before
 * {@link #execute(Object, JobContext)} is called. A normal return completes the job with the
 * returned output; any exception fails it with the exception message.
 */
public interface JobHandler<T> {
    String type();

    Class<T> payloadClass();

    String execute(T payload, JobContext context) throws Exception;
}
