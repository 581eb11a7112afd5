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

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.fanfold.core.AggregationReply;
import dev.mars.fanfold.core.AggregationRequest;
import dev.mars.fanfold.core.ChunkTask;
import dev.mars.fanfold.core.PartialResult;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Registers default event bus codecs for every Fanfold message type.
 *
 * <p>Must run once per Vert.x instance before any verticle sends a message.
 * Registering again on the same instance is harmless.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 */
public final class FanfoldCodecs {

    private static final Logger logger = LoggerFactory.getLogger(FanfoldCodecs.class);

    private static final ObjectMapper MAPPER = createObjectMapper();

    private static final List<Class<?>> MESSAGE_TYPES = List.of(
            AggregationRequest.class,
            ChunkTask.class,
            PartialResult.class,
            AggregationReply.class);

    private FanfoldCodecs() {
    }

    /**
     * Mapper bound to annotated fields only, so getters returning Optional or
     * defensive copies never leak into the wire form.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE);
        mapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
        mapper.setVisibility(PropertyAccessor.CREATOR, JsonAutoDetect.Visibility.ANY);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    public static void registerAll(Vertx vertx) {
        EventBus eventBus = vertx.eventBus();
        for (Class<?> type : MESSAGE_TYPES) {
            register(eventBus, type);
        }
    }

    private static <T> void register(EventBus eventBus, Class<T> type) {
        try {
            eventBus.registerDefaultCodec(type, new JsonMessageCodec<>(type, MAPPER));
            logger.debug("Registered event bus codec for {}", type.getSimpleName());
        } catch (IllegalStateException e) {
            logger.debug("Codec for {} already registered: {}", type.getSimpleName(), e.getMessage());
        }
    }
}
