package io.avroxform.core.engine.avro;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import org.apache.avro.io.BinaryDecoder;
import org.apache.avro.io.Decoder;
import org.apache.avro.io.DecoderFactory;
import org.apache.avro.util.Utf8;

/**
 * Binary decoder over a byte range that refuses length prefixes larger than the bytes left in the
 * range. Strings and bytes are allocated only after their declared length has been checked, so a
 * corrupt length ends the read with {@link EOFException} instead of a huge allocation.
 *
 * <p>Everything else delegates to a direct (unbuffered) {@link BinaryDecoder}, which keeps
 * {@link #consumed()} exact.
 */
final class BoundedDecoder extends Decoder {

    private final ByteArrayInputStream in;
    private final BinaryDecoder delegate;
    private final int length;

    BoundedDecoder(byte[] buffer, int offset) {
        this.length = buffer.length - offset;
        this.in = new ByteArrayInputStream(buffer, offset, length);
        this.delegate = DecoderFactory.get().directBinaryDecoder(in, null);
    }

    /** Bytes left in the range. Also the upper bound for any collection capacity. */
    int remaining() {
        return in.available();
    }

    /** Bytes read so far. */
    int consumed() {
        return length - in.available();
    }

    private int checkedLength() throws IOException {
        long declared = delegate.readLong();
        if (declared < 0) {
            throw new IOException("Negative length: " + declared);
        }
        if (declared > remaining()) {
            throw new EOFException("Length " + declared + " exceeds the " + remaining() + " bytes left");
        }
        return (int) declared;
    }

    @Override
    public Utf8 readString(Utf8 old) throws IOException {
        int n = checkedLength();
        Utf8 result = old != null ? old : new Utf8();
        result.setByteLength(n);
        if (n > 0) {
            delegate.readFixed(result.getBytes(), 0, n);
        }
        return result;
    }

    @Override
    public String readString() throws IOException {
        return readString(null).toString();
    }

    @Override
    public void skipString() throws IOException {
        delegate.skipFixed(checkedLength());
    }

    @Override
    public ByteBuffer readBytes(ByteBuffer old) throws IOException {
        int n = checkedLength();
        byte[] bytes = new byte[n];
        delegate.readFixed(bytes, 0, n);
        return ByteBuffer.wrap(bytes);
    }

    @Override
    public void skipBytes() throws IOException {
        delegate.skipFixed(checkedLength());
    }

    @Override
    public void readNull() throws IOException {
        delegate.readNull();
    }

    @Override
    public boolean readBoolean() throws IOException {
        return delegate.readBoolean();
    }

    @Override
    public int readInt() throws IOException {
        return delegate.readInt();
    }

    @Override
    public long readLong() throws IOException {
        return delegate.readLong();
    }

    @Override
    public float readFloat() throws IOException {
        return delegate.readFloat();
    }

    @Override
    public double readDouble() throws IOException {
        return delegate.readDouble();
    }

    @Override
    public void readFixed(byte[] bytes, int start, int len) throws IOException {
        delegate.readFixed(bytes, start, len);
    }

    @Override
    public void skipFixed(int len) throws IOException {
        delegate.skipFixed(len);
    }

    @Override
    public int readEnum() throws IOException {
        return delegate.readEnum();
    }

    @Override
    public long readArrayStart() throws IOException {
        return delegate.readArrayStart();
    }

    @Override
    public long arrayNext() throws IOException {
        return delegate.arrayNext();
    }

    @Override
    public long skipArray() throws IOException {
        return delegate.skipArray();
    }

    @Override
    public long readMapStart() throws IOException {
        return delegate.readMapStart();
    }

    @Override
    public long mapNext() throws IOException {
        return delegate.mapNext();
    }

    @Override
    public long skipMap() throws IOException {
        return delegate.skipMap();
    }

    @Override
    public int readIndex() throws IOException {
        return delegate.readIndex();
    }
}
