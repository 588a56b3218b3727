package org.poridhi.api.interfaces;

/*
AutoCloseable will help me to close my server automatically
 */
public interface IHttpServer extends AutoCloseable {
    void start(int port) throws Exception;

    /** Bound port, useful when started on port 0. */
    int port();

    @Override void close() throws Exception;
}
