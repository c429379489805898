/*
 * Copyright (C) celltrace contributors
 *
 * This File is part of celltrace
 *
 * celltrace is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * celltrace is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with celltrace.  If not, see <http://www.gnu.org/licenses/>.
 */
package celltrace.image;

import celltrace.utils.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/**
 * On-disk frame stack of shape (frames, height, width). Frames are read and written one at a time through memory-mapped regions so that a stack never needs to fit in memory.
 * <p>
 * Layout: 8-byte magic, pixel type code, frames, height, width (int32 each), padding up to {@link #HEADER_SIZE} bytes, then row-major frames.
 * <p>
 * Stacks are created through a {@link Writer} that writes to a temporary file next to the target; the target only appears when {@link Writer#commit()} is called, so an existing stack is always complete.
 */
public class StackFile implements Closeable {
    static final Logger logger = LoggerFactory.getLogger(StackFile.class);
    public static final long MAGIC = 0x4354535441434b31L; // CTSTACK1
    public static final int HEADER_SIZE = 32;
    final File file;
    final PixelType type;
    final int nFrames, height, width;
    RandomAccessFile raf;
    FileChannel fc;

    protected StackFile(File file, PixelType type, int nFrames, int height, int width) {
        this.file = file;
        this.type = type;
        this.nFrames = nFrames;
        this.height = height;
        this.width = width;
    }

    public static StackFile open(File file) throws IOException {
        if (!file.exists()) throw new FileNotFoundException("Stack not found: "+file.getAbsolutePath());
        RandomAccessFile raf = new RandomAccessFile(file, "r");
        try {
            FileChannel fc = raf.getChannel();
            if (fc.size()<HEADER_SIZE) throw new IOException("Truncated stack header: "+file);
            ByteBuffer buf = fc.map(FileChannel.MapMode.READ_ONLY, 0, HEADER_SIZE);
            if (buf.getLong()!=MAGIC) throw new IOException("Not a stack file: "+file);
            PixelType type = PixelType.fromCode(buf.getInt());
            int t = buf.getInt(), h = buf.getInt(), w = buf.getInt();
            StackFile res = new StackFile(file, type, t, h, w);
            if (fc.size() < res.expectedSize()) throw new IOException("Truncated stack: "+file+" size="+fc.size()+" expected="+res.expectedSize());
            res.raf = raf;
            res.fc = fc;
            return res;
        } catch (IOException|RuntimeException e) {
            raf.close();
            throw e;
        }
    }

    public static Writer create(File target, PixelType type, int nFrames, int height, int width) throws IOException {
        return new Writer(target, type, nFrames, height, width);
    }

    public File getFile() {
        return file;
    }
    public PixelType getType() {
        return type;
    }
    public int sizeT() {
        return nFrames;
    }
    public int sizeY() {
        return height;
    }
    public int sizeX() {
        return width;
    }
    public int[] shape() {
        return new int[]{nFrames, height, width};
    }
    public boolean sameShape(StackFile other) {
        return nFrames==other.nFrames && height==other.height && width==other.width;
    }
    long frameBytes() {
        return (long)height * width * type.bytes;
    }
    long expectedSize() {
        return HEADER_SIZE + frameBytes() * nFrames;
    }
    long frameOffset(int t) {
        if (t<0 || t>=nFrames) throw new IndexOutOfBoundsException("frame "+t+" not in [0;"+nFrames+")");
        return HEADER_SIZE + frameBytes() * t;
    }

    public float[] readFloat(int t) throws IOException {
        return readFloat(t, new float[height * width]);
    }
    public float[] readFloat(int t, float[] dest) throws IOException {
        ByteBuffer buf = fc.map(FileChannel.MapMode.READ_ONLY, frameOffset(t), frameBytes());
        int size = height * width;
        switch (type) {
            case UINT8:
                for (int i = 0; i<size; ++i) dest[i] = buf.get(i) & 0xff;
                break;
            case UINT16:
                for (int i = 0; i<size; ++i) dest[i] = buf.getShort(2 * i) & 0xffff;
                break;
            default:
                for (int i = 0; i<size; ++i) dest[i] = buf.getFloat(4 * i);
        }
        return dest;
    }
    public int[] readInt(int t) throws IOException {
        return readInt(t, new int[height * width]);
    }
    public int[] readInt(int t, int[] dest) throws IOException {
        ByteBuffer buf = fc.map(FileChannel.MapMode.READ_ONLY, frameOffset(t), frameBytes());
        int size = height * width;
        switch (type) {
            case UINT8:
                for (int i = 0; i<size; ++i) dest[i] = buf.get(i) & 0xff;
                break;
            case UINT16:
                for (int i = 0; i<size; ++i) dest[i] = buf.getShort(2 * i) & 0xffff;
                break;
            default:
                for (int i = 0; i<size; ++i) dest[i] = (int)buf.getFloat(4 * i);
        }
        return dest;
    }

    @Override
    public void close() throws IOException {
        if (raf!=null) {
            fc.close();
            raf.close();
            raf = null;
            fc = null;
        }
    }

    @Override
    public String toString() {
        return file.getName()+"["+type+" "+nFrames+"x"+height+"x"+width+"]";
    }

    public static class Writer extends StackFile {
        final File part;
        boolean committed;
        Writer(File target, PixelType type, int nFrames, int height, int width) throws IOException {
            super(target, type, nFrames, height, width);
            if (nFrames<=0 || height<=0 || width<=0) throw new IllegalArgumentException("Invalid stack shape: "+nFrames+"x"+height+"x"+width);
            if (target.getParentFile()!=null) target.getParentFile().mkdirs();
            part = FileIO.partFile(target);
            raf = new RandomAccessFile(part, "rw");
            try {
                raf.setLength(expectedSize());
                fc = raf.getChannel();
                ByteBuffer buf = fc.map(FileChannel.MapMode.READ_WRITE, 0, HEADER_SIZE);
                buf.putLong(MAGIC).putInt(type.code).putInt(nFrames).putInt(height).putInt(width);
            } catch (IOException|RuntimeException e) {
                raf.close();
                FileIO.delete(part);
                throw e;
            }
        }
        public void writeFrame(int t, int[] values) throws IOException {
            checkFrameSize(values.length);
            ByteBuffer buf = fc.map(FileChannel.MapMode.READ_WRITE, frameOffset(t), frameBytes());
            switch (type) {
                case UINT8:
                    for (int v : values) buf.put((byte)v);
                    break;
                case UINT16:
                    for (int v : values) buf.putShort((short)v);
                    break;
                default:
                    for (int v : values) buf.putFloat(v);
            }
        }
        public void writeFrame(int t, float[] values) throws IOException {
            checkFrameSize(values.length);
            ByteBuffer buf = fc.map(FileChannel.MapMode.READ_WRITE, frameOffset(t), frameBytes());
            switch (type) {
                case UINT8:
                    for (float v : values) buf.put((byte)Math.round(v));
                    break;
                case UINT16:
                    for (float v : values) buf.putShort((short)Math.round(v));
                    break;
                default:
                    for (float v : values) buf.putFloat(v);
            }
        }
        public void writeFrame(int t, short[] values) throws IOException {
            if (type!=PixelType.UINT16) throw new IllegalArgumentException("short frames can only be written to UINT16 stacks");
            checkFrameSize(values.length);
            ByteBuffer buf = fc.map(FileChannel.MapMode.READ_WRITE, frameOffset(t), frameBytes());
            for (short v : values) buf.putShort(v);
        }

        private void checkFrameSize(int length) {
            if (length!=sizeX() * sizeY()) throw new IllegalArgumentException("Frame of "+length+" pixels cannot be written to "+this+": expected "+sizeY()+"x"+sizeX()+"="+sizeX() * sizeY()+" pixels");
        }

        /**
         * Moves the written data to the target path.
         */
        public void commit() throws IOException {
            fc.force(false);
            super.close();
            FileIO.commit(part, file);
            committed = true;
        }

        /**
         * Discards written data. No-op once committed.
         */
        public void abort() throws IOException {
            if (committed) return;
            super.close();
            if (!FileIO.delete(part)) throw new IOException("Could not remove partial output: "+part);
        }

        @Override
        public void close() throws IOException {
            abort();
        }
    }
}
