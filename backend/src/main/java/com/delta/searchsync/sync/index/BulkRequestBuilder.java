package com.delta.searchsync.sync.index;

import com.delta.searchsync.sync.model.IndexedDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class BulkRequestBuilder {
    private final ObjectMapper objectMapper;

    public BulkRequestBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String indexActions(String index, List<IndexedDocument> documents) {
        StringBuilder body = new StringBuilder();
        for (IndexedDocument document : documents) {
            body.append(writeLine(actionLine("index", index, document.id())));
            body.append(writeLine(document.source()));
        }
        return body.toString();
    }

    public String deleteActions(String index, List<String> ids) {
        StringBuilder body = new StringBuilder();
        for (String id : ids) {
            body.append(writeLine(actionLine("delete", index, id)));
        }
        return body.toString();
    }

    private ObjectNode actionLine(String action, String index, String id) {
        ObjectNode line = objectMapper.createObjectNode();
        line.putObject(action)
            .put("_index", index)
            .put("_id", id);
        return line;
    }

    private String writeLine(Object value) {
        try {
            return objectMapper.writeValueAsString(value) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize bulk line", e);
        }
    }
}
