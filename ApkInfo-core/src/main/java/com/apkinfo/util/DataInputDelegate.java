package com.apkinfo.util;

import java.io.DataInput;
import java.io.IOException;

public class DataInputDelegate implements DataInput {
    protected final DataInput mDelegate;

    public DataInputDelegate(DataInput delegate) {
        this.mDelegate = delegate;
    }

    @Override
    public void readFully(byte[] b) throws IOException {
        this.mDelegate.readFully(b);
    }

    @Override
    public void readFully(byte[] b, int off, int len) throws IOException {
        this.mDelegate.readFully(b, off, len);
    }

    @Override
    public int skipBytes(int n) throws IOException {
        return this.mDelegate.skipBytes(n);
    }

    @Override
    public boolean readBoolean() throws IOException {
        return this.mDelegate.readBoolean();
    }

    @Override
    public byte readByte() throws IOException {
        return this.mDelegate.readByte();
    }

    @Override
    public int readUnsignedByte() throws IOException {
        return this.mDelegate.readUnsignedByte();
    }

    @Override
    public short readShort() throws IOException {
        return this.mDelegate.readShort();
    }

    @Override
    public int readUnsignedShort() throws IOException {
        return this.mDelegate.readUnsignedShort();
    }

    @Override
    public char readChar() throws IOException {
        return this.mDelegate.readChar();
    }

    @Override
    public int readInt() throws IOException {
        return this.mDelegate.readInt();
    }

    @Override
    public long readLong() throws IOException {
        return this.mDelegate.readLong();
    }

    @Override
    public float readFloat() throws IOException {
        return this.mDelegate.readFloat();
    }

    @Override
    public double readDouble() throws IOException {
        return this.mDelegate.readDouble();
    }

    @Override
    public String readLine() throws IOException {
        return this.mDelegate.readLine();
    }

    @Override
    public String readUTF() throws IOException {
        return this.mDelegate.readUTF();
    }
}
