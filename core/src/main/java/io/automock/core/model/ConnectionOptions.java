package io.automock.core.model;

import java.util.Objects;

/**
 * Socket-level response behaviour understood by the target mocking engine.
 *
 * <p>
 * Mutable; owned by a single {@link ResponseDefinition}. {@link #copy()}
 * returns an independent instance.
 */
public final class ConnectionOptions {

    private boolean dropConnection;
    private boolean suppressConnectionHeader;
    private boolean suppressContentLengthHeader;
    private Integer contentLengthHeaderOverride;
    private Integer chunkSize;
    private Boolean keepAliveOverride;
    private boolean closeSocket;
    private Delay closeSocketDelay;

    public ConnectionOptions() {}

    /** Returns an independent copy. */
    public ConnectionOptions copy() {
        ConnectionOptions copy = new ConnectionOptions();
        copy.dropConnection = dropConnection;
        copy.suppressConnectionHeader = suppressConnectionHeader;
        copy.suppressContentLengthHeader = suppressContentLengthHeader;
        copy.contentLengthHeaderOverride = contentLengthHeaderOverride;
        copy.chunkSize = chunkSize;
        copy.keepAliveOverride = keepAliveOverride;
        copy.closeSocket = closeSocket;
        copy.closeSocketDelay = closeSocketDelay;
        return copy;
    }

    /** True if no option deviates from the engine defaults. */
    public boolean isEmpty() {
        return !dropConnection
                && !suppressConnectionHeader
                && !suppressContentLengthHeader
                && contentLengthHeaderOverride == null
                && chunkSize == null
                && keepAliveOverride == null
                && !closeSocket
                && closeSocketDelay == null;
    }

    public boolean dropConnection() {
        return dropConnection;
    }

    public ConnectionOptions dropConnection(boolean dropConnection) {
        this.dropConnection = dropConnection;
        return this;
    }

    public boolean suppressConnectionHeader() {
        return suppressConnectionHeader;
    }

    public ConnectionOptions suppressConnectionHeader(boolean suppressConnectionHeader) {
        this.suppressConnectionHeader = suppressConnectionHeader;
        return this;
    }

    public boolean suppressContentLengthHeader() {
        return suppressContentLengthHeader;
    }

    public ConnectionOptions suppressContentLengthHeader(boolean suppressContentLengthHeader) {
        this.suppressContentLengthHeader = suppressContentLengthHeader;
        return this;
    }

    /** Explicit Content-Length value, or {@code null} to let the engine compute it. */
    public Integer contentLengthHeaderOverride() {
        return contentLengthHeaderOverride;
    }

    public ConnectionOptions contentLengthHeaderOverride(Integer contentLengthHeaderOverride) {
        this.contentLengthHeaderOverride = contentLengthHeaderOverride;
        return this;
    }

    /** Chunk size in bytes for chunked transfer encoding, or {@code null}. */
    public Integer chunkSize() {
        return chunkSize;
    }

    public ConnectionOptions chunkSize(Integer chunkSize) {
        this.chunkSize = chunkSize;
        return this;
    }

    /** Keep-alive override, or {@code null} for the engine default. */
    public Boolean keepAliveOverride() {
        return keepAliveOverride;
    }

    public ConnectionOptions keepAliveOverride(Boolean keepAliveOverride) {
        this.keepAliveOverride = keepAliveOverride;
        return this;
    }

    public boolean closeSocket() {
        return closeSocket;
    }

    public ConnectionOptions closeSocket(boolean closeSocket) {
        this.closeSocket = closeSocket;
        return this;
    }

    /** Delay before the socket is closed, or {@code null} to close immediately. */
    public Delay closeSocketDelay() {
        return closeSocketDelay;
    }

    public ConnectionOptions closeSocketDelay(Delay closeSocketDelay) {
        this.closeSocketDelay = closeSocketDelay;
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConnectionOptions that)) return false;
        return dropConnection == that.dropConnection
                && suppressConnectionHeader == that.suppressConnectionHeader
                && suppressContentLengthHeader == that.suppressContentLengthHeader
                && closeSocket == that.closeSocket
                && Objects.equals(contentLengthHeaderOverride, that.contentLengthHeaderOverride)
                && Objects.equals(chunkSize, that.chunkSize)
                && Objects.equals(keepAliveOverride, that.keepAliveOverride)
                && Objects.equals(closeSocketDelay, that.closeSocketDelay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                dropConnection,
                suppressConnectionHeader,
                suppressContentLengthHeader,
                contentLengthHeaderOverride,
                chunkSize,
                keepAliveOverride,
                closeSocket,
                closeSocketDelay);
    }
}
