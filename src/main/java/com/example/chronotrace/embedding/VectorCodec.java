package com.example.chronotrace.embedding;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * GZIP-compressed float blobs used for vector columns: a length prefix followed by the floats.
 */
public final class VectorCodec {

    private VectorCodec() {}

    public static byte[] encode(EmbeddingVector vector) {
        float[] arr = vector.toArray();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (GZIPOutputStream gz = new GZIPOutputStream(baos);
             DataOutputStream dos = new DataOutputStream(gz)) {
            dos.writeInt(arr.length);
            for (float f : arr) dos.writeFloat(f);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return baos.toByteArray();
    }

    public static EmbeddingVector decode(byte[] blob) {
        try (GZIPInputStream gzis = new GZIPInputStream(new ByteArrayInputStream(blob));
             DataInputStream dis = new DataInputStream(gzis)) {
            int len = dis.readInt();
            float[] arr = new float[len];
            for (int i = 0; i < len; i++) arr[i] = dis.readFloat();
            return EmbeddingVector.of(arr);
        } catch (IOException e) {
            throw new UncheckedIOException("malformed vector blob", e);
        }
    }
}
