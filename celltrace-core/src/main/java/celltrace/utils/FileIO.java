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
package celltrace.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.Iterator;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

public class FileIO {
    public static final Logger logger = LoggerFactory.getLogger(FileIO.class);
    public static final String PART_SUFFIX = ".part";

    /**
     * Writes one line per object. Header line is written first when not null, so that an empty collection still yields a valid file.
     */
    public static <T> void writeToFile(File output, String header, Collection<T> objects, Function<T, String> converter) throws IOException {
        if (output.getParentFile()!=null) output.getParentFile().mkdirs();
        try (BufferedWriter out = Files.newBufferedWriter(output.toPath(), StandardCharsets.UTF_8)) {
            if (header!=null) {
                out.write(header);
                out.newLine();
            }
            Iterator<String> it = objects.stream().map(converter).collect(Collectors.toList()).iterator();
            while(it.hasNext()) {
                out.write(it.next());
                out.newLine();
            }
        }
    }

    public static String readToString(File file) throws IOException {
        if (!file.exists()) throw new FileNotFoundException(file.getAbsolutePath());
        return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
    }

    public static File partFile(File target) {
        return new File(target.getParentFile(), target.getName() + PART_SUFFIX);
    }

    /**
     * Moves a fully written temporary file to its final location
     */
    public static void commit(File part, File target) throws IOException {
        try {
            Files.move(part.toPath(), target.toPath(), StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(part.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * @return true if the file does not exist anymore
     */
    public static boolean delete(File file) {
        try {
            Files.deleteIfExists(file.toPath());
            return true;
        } catch (IOException e) {
            logger.error("could not delete file: {}", file, e);
            return false;
        }
    }

    public static class ZipWriter implements Closeable {
        final File f;
        final ZipOutputStream out;
        public ZipWriter(File f) throws FileNotFoundException {
            this.f = f;
            out  = new ZipOutputStream(new FileOutputStream(f));
            out.setLevel(1);
        }
        public File getFile() {
            return f;
        }
        public void writeString(String relativePath, String content) throws IOException {
            write(relativePath, content.getBytes(StandardCharsets.UTF_8));
        }
        public void write(String relativePath, byte[] content) throws IOException {
            ZipEntry e= new ZipEntry(relativePath);
            out.putNextEntry(e);
            out.write(content);
            out.closeEntry();
        }
        @Override
        public void close() throws IOException {
            out.close();
        }
    }

    public static class ZipReader implements Closeable {
        final ZipFile in;
        public ZipReader(File file) throws IOException {
            if (!file.exists()) throw new FileNotFoundException(file.getAbsolutePath());
            in = new ZipFile(file);
        }
        public boolean contains(String relativePath) {
            return in.getEntry(relativePath)!=null;
        }
        public String readString(String relativePath) throws IOException {
            try (InputStream is = readFile(relativePath);
                 BufferedReader r = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return r.lines().collect(Collectors.joining("\n"));
            }
        }
        public InputStream readFile(String relativePath) throws IOException {
            ZipEntry e = in.getEntry(relativePath);
            if (e==null) throw new FileNotFoundException("entry not found: "+relativePath);
            return in.getInputStream(e);
        }
        @Override
        public void close() throws IOException {
            in.close();
        }
    }
}
