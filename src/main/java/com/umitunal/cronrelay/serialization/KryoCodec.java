package com.umitunal.cronrelay.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.umitunal.cronrelay.exception.CodecException;

import java.io.ByteArrayOutputStream;

/**
 * Binary serialization using Kryo, used for consumer group bookkeeping records.
 * Kryo instances are not thread-safe, so one is kept per thread.
 *
 * @param <T> the type to serialize
 */
public class KryoCodec<T> implements PayloadCodec<T> {
    private final ThreadLocal<Kryo> kryoThreadLocal;
    private final Class<T> type;

    public KryoCodec(Class<T> type) {
        this(type, Factories::defaultFactory);
    }

    /**
     * Create a Kryo codec with custom Kryo instance configuration.
     */
    public KryoCodec(Class<T> type, KryoFactory factory) {
        this.type = type;
        this.kryoThreadLocal = ThreadLocal.withInitial(factory::create);
    }

    @Override
    public byte[] encode(T value) {
        Kryo kryo = kryoThreadLocal.get();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();

        try (Output output = new Output(baos)) {
            kryo.writeObject(output, value);
            output.flush();
            return baos.toByteArray();
        } catch (KryoException e) {
            throw new CodecException("Failed to serialize " + type.getSimpleName(), e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        Kryo kryo = kryoThreadLocal.get();

        try (Input input = new Input(bytes)) {
            return kryo.readObject(input, type);
        } catch (KryoException e) {
            throw new CodecException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    /**
     * Factory interface for custom Kryo configuration.
     */
    @FunctionalInterface
    public interface KryoFactory {
        Kryo create();
    }

    public static class Factories {

        /**
         * Registration not required, no reference tracking. Suitable for flat records.
         */
        public static Kryo defaultFactory() {
            Kryo kryo = new Kryo();
            kryo.setRegistrationRequired(false);
            kryo.setReferences(false);
            return kryo;
        }
    }
}
