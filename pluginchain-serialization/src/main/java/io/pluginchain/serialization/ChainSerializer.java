package io.pluginchain.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.pluginchain.core.chain.Chain;
import io.pluginchain.core.execution.RunSnapshot;

/// Utility class for serializing chains and run snapshots to and from JSON.
///
/// ### Usage
/// {@snippet :
/// String json = ChainSerializer.toJson(chain);
/// Chain restored = ChainSerializer.fromJson(json);
///
/// String archived = ChainSerializer.snapshotToJson(run.snapshot());
/// }
///
/// A deserialized chain is rebuilt through `Chain.Builder`, so it carries the same id and
/// canonical form as the original and passes the same validation.
///
/// @implNote Thread-safe. The mapper is created per call via `createMapper()`; cache one
/// for high-throughput use.
///
/// @see PluginChainJacksonModule for the registered type handlers
public final class ChainSerializer {

    private ChainSerializer() {}

    /// Serializes a chain to pretty-printed JSON.
    ///
    /// @param chain the chain to serialize, not null
    /// @return JSON representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Chain chain) {
        try {
            return createMapper().writeValueAsString(chain);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize chain: " + e.getMessage(), e);
        }
    }

    /// Deserializes a chain from JSON.
    ///
    /// @param json JSON string, not null
    /// @return validated chain, never null
    /// @throws IllegalArgumentException if the JSON is malformed or describes an invalid chain
    public static Chain fromJson(String json) {
        try {
            return createMapper().readValue(json, Chain.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize chain: " + e.getMessage(), e);
        }
    }

    public static String snapshotToJson(RunSnapshot snapshot) {
        try {
            return createMapper().writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize run snapshot: " + e.getMessage(), e);
        }
    }

    public static RunSnapshot snapshotFromJson(String json) {
        try {
            return createMapper().readValue(json, RunSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize run snapshot: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for plugin chain serialization.
    ///
    /// Registers:
    /// - `PluginChainJacksonModule` for chains and descriptors
    /// - `JavaTimeModule` for `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new PluginChainJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
