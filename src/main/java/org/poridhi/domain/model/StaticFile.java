package org.poridhi.domain.model;

/** Bytes of a resolved static file plus the MIME type to serve it with. */
public final class StaticFile {
    public final byte[] data;
    public final String mimeType;

    public StaticFile(byte[] data, String mimeType) {
        this.data = data;
        this.mimeType = mimeType;
    }
}
