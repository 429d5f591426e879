package com.umitunal.cronrelay.serialization;

import com.umitunal.cronrelay.exception.CodecException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Compact serializer for the flat field set of a stream entry.
 *
 * Binary format:
 * - field count (4 bytes)
 * - per field, in insertion order:
 *   - name length (4 bytes) + name bytes (UTF-8)
 *   - value length (4 bytes, -1 for null) + value bytes (UTF-8)
 */
public class FieldSetCodec implements PayloadCodec<Map<String, String>> {

    @Override
    public byte[] encode(Map<String, String> fields) {
        byte[][] names = new byte[fields.size()][];
        byte[][] values = new byte[fields.size()][];

        int totalSize = 4;
        int i = 0;
        for (Map.Entry<String, String> field : fields.entrySet()) {
            names[i] = field.getKey().getBytes(UTF_8);
            values[i] = field.getValue() != null ? field.getValue().getBytes(UTF_8) : null;
            totalSize += 4 + names[i].length + 4 + (values[i] != null ? values[i].length : 0);
            i++;
        }

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        buffer.putInt(fields.size());
        for (int j = 0; j < names.length; j++) {
            buffer.putInt(names[j].length);
            buffer.put(names[j]);
            if (values[j] == null) {
                buffer.putInt(-1);
            } else {
                buffer.putInt(values[j].length);
                buffer.put(values[j]);
            }
        }
        return buffer.array();
    }

    /**
     * @throws CodecException if the bytes are truncated or malformed
     */
    @Override
    public Map<String, String> decode(byte[] bytes) {
        try {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            int count = buffer.getInt();
            if (count < 0) {
                throw new CodecException("Negative field count: " + count, null);
            }
            Map<String, String> fields = new LinkedHashMap<>();

            for (int i = 0; i < count; i++) {
                byte[] name = new byte[buffer.getInt()];
                buffer.get(name);

                int valueLength = buffer.getInt();
                String value = null;
                if (valueLength >= 0) {
                    byte[] valueBytes = new byte[valueLength];
                    buffer.get(valueBytes);
                    value = new String(valueBytes, UTF_8);
                }
                fields.put(new String(name, UTF_8), value);
            }
            return fields;
        } catch (BufferUnderflowException | NegativeArraySizeException e) {
            throw new CodecException("Truncated or malformed field set", e);
        }
    }
}
