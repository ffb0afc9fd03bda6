package com.sailfish.taskproc.service.impl;

import com.sailfish.taskproc.exception.TaskProcessorException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.NotSerializableException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;

/**
 * Java serialization of task arguments, options and results as stored in the broker and result store.
 */
public class PayloadSerializer {

    /**
     * @param value a Serializable value or null.
     * @return the serialized bytes, null for a null value.
     * @throws IllegalArgumentException if the value (or anything it references) is not Serializable.
     */
    public byte[] serialize(Object value) {
        if (value == null) {
            return null;
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(value);
        } catch (NotSerializableException e) {
            throw new IllegalArgumentException("Value is not serializable: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new TaskProcessorException("Failed to serialize " + value.getClass().getName(), e);
        }
        return bytes.toByteArray();
    }

    public Object deserialize(byte[] data) {
        if (data == null) {
            return null;
        }
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(data))) {
            return in.readObject();
        } catch (IOException | ClassNotFoundException e) {
            throw new TaskProcessorException("Failed to deserialize stored payload", e);
        }
    }
}
