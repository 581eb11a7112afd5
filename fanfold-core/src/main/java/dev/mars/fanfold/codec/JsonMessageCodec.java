/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.fanfold.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.eventbus.MessageCodec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Event bus codec for immutable Fanfold messages.
 *
 * <p>Local delivery passes the instance through untouched since every message type
 * is immutable. The wire form is a length-prefixed Jackson JSON document.</p>
 *
 * @param <T> the message type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 */
public class JsonMessageCodec<T> implements MessageCodec<T, T> {

    private final Class<T> type;
    private final ObjectMapper mapper;
    private final String name;

    public JsonMessageCodec(Class<T> type, ObjectMapper mapper) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
        this.name = "fanfold-json-" + type.getSimpleName();
    }

    @Override
    public void encodeToWire(Buffer buffer, T message) {
        try {
            byte[] bytes = mapper.writeValueAsBytes(message);
            buffer.appendInt(bytes.length);
            buffer.appendBytes(bytes);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode " + type.getSimpleName(), e);
        }
    }

    @Override
    public T decodeFromWire(int pos, Buffer buffer) {
        int length = buffer.getInt(pos);
        int start = pos + Integer.BYTES;
        byte[] bytes = buffer.getBytes(start, start + length);
        try {
            return mapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decode " + type.getSimpleName(), e);
        }
    }

    @Override
    public T transform(T message) {
        return message;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public byte systemCodecID() {
        return -1;
    }

    public Class<T> getType() {
        return type;
    }
}
