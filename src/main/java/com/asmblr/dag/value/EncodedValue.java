package com.asmblr.dag.value;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.Data;

/**
 * Tagged wire form of a {@link Value}.
 *
 * <p>
 * {@code type} selects the variant, {@code data} holds the payload. Binary
 * variants add {@code shape} and {@code dtype} (and {@code device} for tensors);
 * the {@code other} variant may add {@code class}, the name of the type it was
 * rendered from.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EncodedValue {
    private String type;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private JsonNode data;

    private List<Integer> shape;
    private String dtype;
    private String device;

    @JsonProperty("class")
    private String sourceType;
}
