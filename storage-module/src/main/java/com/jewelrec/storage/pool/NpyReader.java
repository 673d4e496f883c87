package com.jewelrec.storage.pool;

import com.jewelrec.common.exception.IndexBuildException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Чтение двумерной матрицы эмбеддингов из файла NumPy {@code .npy}.
 * Поддерживаются float32 и float64, little-endian, порядок C.
 */
public final class NpyReader {

    private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
    private static final Pattern DESCR = Pattern.compile("'descr'\\s*:\\s*'([^']+)'");
    private static final Pattern FORTRAN = Pattern.compile("'fortran_order'\\s*:\\s*(True|False)");
    private static final Pattern SHAPE = Pattern.compile("'shape'\\s*:\\s*\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*,?\\s*\\)");

    private NpyReader() {
    }

    public static float[][] read(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new IndexBuildException("Failed to read embeddings file " + file, e);
        }
        return parse(bytes, file.toString());
    }

    static float[][] parse(byte[] bytes, String source) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        if (bytes.length < MAGIC.length + 4) {
            throw corrupt(source, "file too short");
        }
        for (int i = 0; i < MAGIC.length; i++) {
            if (buffer.get() != MAGIC[i]) {
                throw corrupt(source, "bad magic string");
            }
        }
        int major = buffer.get() & 0xFF;
        buffer.get(); // minor
        int headerLength = major == 1 ? buffer.getShort() & 0xFFFF : buffer.getInt();
        if (headerLength < 0 || buffer.remaining() < headerLength) {
            throw corrupt(source, "truncated header");
        }
        byte[] headerBytes = new byte[headerLength];
        buffer.get(headerBytes);
        String header = new String(headerBytes, StandardCharsets.ISO_8859_1);

        String descr = find(DESCR, header, source, "descr").group(1);
        if ("True".equals(find(FORTRAN, header, source, "fortran_order").group(1))) {
            throw corrupt(source, "Fortran order is not supported");
        }
        Matcher shape = find(SHAPE, header, source, "2-D shape");
        int rows = Integer.parseInt(shape.group(1));
        int cols = Integer.parseInt(shape.group(2));

        int elementSize = switch (descr) {
            case "<f4", "=f4" -> 4;
            case "<f8", "=f8" -> 8;
            default -> throw corrupt(source, "unsupported dtype " + descr);
        };
        long expected = (long) rows * cols * elementSize;
        if (buffer.remaining() < expected) {
            throw corrupt(source, String.format("expected %d data bytes, found %d", expected, buffer.remaining()));
        }

        float[][] matrix = new float[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                matrix[r][c] = elementSize == 4 ? buffer.getFloat() : (float) buffer.getDouble();
            }
        }
        return matrix;
    }

    private static Matcher find(Pattern pattern, String header, String source, String what) {
        Matcher matcher = pattern.matcher(header);
        if (!matcher.find()) {
            throw corrupt(source, "header has no " + what);
        }
        return matcher;
    }

    private static IndexBuildException corrupt(String source, String reason) {
        return new IndexBuildException("Corrupt embeddings file " + source + ": " + reason);
    }
}
