package com.parley.worker;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Blocking stream that feeds a container's standard input from any writer thread.
 *
 * <p>Unlike {@link java.io.PipedInputStream} it does not care which thread wrote last,
 * which matters because the loop thread and I/O threads both write requests.
 */
final class StdinPipe extends InputStream {

    private static final byte[] EOF = new byte[0];

    private final LinkedBlockingQueue<byte[]> chunks = new LinkedBlockingQueue<>();
    private volatile boolean closed;
    private byte[] current;
    private int position;
    private boolean finished;

    void write(byte[] data) throws IOException {
        if (closed) {
            throw new IOException("Worker input is closed");
        }
        chunks.add(data.clone());
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public int read() throws IOException {
        byte[] one = new byte[1];
        int n = read(one, 0, 1);
        return n < 0 ? -1 : one[0] & 0xff;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        if (length == 0) return 0;
        if (!fill()) return -1;
        int n = Math.min(length, current.length - position);
        System.arraycopy(current, position, buffer, offset, n);
        position += n;
        return n;
    }

    private boolean fill() throws IOException {
        while (!finished && (current == null || position >= current.length)) {
            try {
                current = chunks.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while waiting for worker input", e);
            }
            position = 0;
            if (current == EOF) {
                finished = true;
            }
        }
        return !finished;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            chunks.add(EOF);
        }
    }
}
