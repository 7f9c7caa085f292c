package io.magicalne.cex.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.magicalne.cex.Utils;
import io.magicalne.cex.exception.MissingEnvelopeFieldException;
import io.magicalne.cex.exception.NormalizationException;
import io.magicalne.cex.exception.RecordDecodeException;
import io.magicalne.cex.exception.SchemaMismatchException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Pulls the record array out of a nested response envelope such as
 * {@code {"data": {"body": {"data": [...]}}}} and decodes its elements.
 */
@Slf4j
public class EnvelopeUnwrapper {

    private static final Joiner DOT = Joiner.on('.');

    private final ObjectMapper objectMapper;
    private final List<String> path;

    public EnvelopeUnwrapper(String... path) {
        this(Utils.objectMapper(), path);
    }

    public EnvelopeUnwrapper(ObjectMapper objectMapper, String... path) {
        Preconditions.checkArgument(path.length > 0, "envelope path must not be empty");
        this.objectMapper = objectMapper;
        this.path = ImmutableList.copyOf(Arrays.asList(path));
    }

    public JsonNode parse(String raw) throws SchemaMismatchException {
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new SchemaMismatchException("Envelope is not a JSON document: " + e.getOriginalMessage(), e);
        }
    }

    public ArrayNode unwrap(String raw) throws NormalizationException {
        return unwrap(parse(raw));
    }

    public ArrayNode unwrap(JsonNode root) throws MissingEnvelopeFieldException, SchemaMismatchException {
        JsonNode node = root;
        for (int i = 0; i < path.size(); i++) {
            String field = path.get(i);
            JsonNode next = node.get(field);
            if (next == null) {
                throw new MissingEnvelopeFieldException(field, DOT.join(path.subList(0, i + 1)));
            }
            node = next;
        }
        if (!node.isArray()) {
            throw new SchemaMismatchException(DOT.join(path), "array", node.getNodeType().toString());
        }
        return (ArrayNode) node;
    }

    /**
     * Decodes every element, failing the whole batch on the first bad one.
     *
     * @param missingField returns the name of a required field the decoded record lacks, or null
     */
    public <T> List<T> decodeAll(ArrayNode records, Class<T> type, Function<? super T, String> missingField)
            throws RecordDecodeException {
        List<T> out = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            T record;
            try {
                record = objectMapper.treeToValue(records.get(i), type);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new RecordDecodeException(i, type, e);
            }
            if (record == null) {
                throw new RecordDecodeException(i, type, "null record");
            }
            String missing = missingField.apply(record);
            if (missing != null) {
                throw new RecordDecodeException(i, type, "missing required field '" + missing + "'");
            }
            out.add(record);
        }
        log.debug("Decoded {} {} records from {}", out.size(), type.getSimpleName(), DOT.join(path));
        return out;
    }

    public <T> List<T> unwrapAll(String raw, Class<T> type, Function<? super T, String> missingField)
            throws NormalizationException {
        return decodeAll(unwrap(raw), type, missingField);
    }
}
