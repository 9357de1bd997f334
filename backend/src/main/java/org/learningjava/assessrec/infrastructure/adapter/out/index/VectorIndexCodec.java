package org.learningjava.assessrec.infrastructure.adapter.out.index;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Binary form of a {@link FlatVectorIndex}:
 * magic "AVIX", format version, model id (length-prefixed UTF-8), row count, dimension,
 * then count * dimension big-endian floats.
 */
final class VectorIndexCodec {

    static final int MAGIC = 0x41564958; // "AVIX"
    static final int VERSION = 2;
    static final int MAX_MODEL_ID_BYTES = 1024;

    /** What a vector file holds: the embedder that produced it and the vectors. */
    record Contents(String modelId, FlatVectorIndex vectors) {
    }

    private VectorIndexCodec() {
    }

    static void write(FlatVectorIndex index, String modelId, Path target) throws IOException {
        byte[] id = (modelId == null ? "" : modelId).getBytes(StandardCharsets.UTF_8);
        try (var out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(target)))) {
            out.writeInt(MAGIC);
            out.writeInt(VERSION);
            out.writeInt(id.length);
            out.write(id);
            out.writeInt(index.size());
            out.writeInt(index.dimension());
            for (float f : index.rawData()) out.writeFloat(f);
        }
    }

    static Contents read(Path source) throws IOException {
        long fileSize = Files.size(source);
        try (var in = new DataInputStream(new BufferedInputStream(Files.newInputStream(source)))) {
            int magic = in.readInt();
            if (magic != MAGIC) {
                throw new IOException("Not a vector index file: " + source);
            }
            int version = in.readInt();
            if (version != VERSION) {
                throw new IOException("Unsupported vector index version " + version + " in " + source);
            }
            int idLength = in.readInt();
            if (idLength < 0 || idLength > MAX_MODEL_ID_BYTES) {
                throw new IOException("Corrupt vector index header in " + source);
            }
            String modelId = new String(in.readNBytes(idLength), StandardCharsets.UTF_8);
            int count = in.readInt();
            int dimension = in.readInt();
            if (count < 0 || dimension < 0) {
                throw new IOException("Corrupt vector index header in " + source);
            }

            // header is five ints plus the model id
            long payloadBytes = fileSize - 20L - idLength;
            long expectedBytes = (long) count * dimension * Float.BYTES;
            if (expectedBytes != payloadBytes || (long) count * dimension > Integer.MAX_VALUE - 8) {
                throw new IOException("Vector index header declares " + count + " x " + dimension
                        + " floats but " + source + " holds " + Math.max(0, payloadBytes) + " payload bytes");
            }

            float[] data = new float[count * dimension];
            for (int i = 0; i < data.length; i++) data[i] = in.readFloat();
            return new Contents(modelId, FlatVectorIndex.fromNormalized(dimension, count, data));
        }
    }
}
