package org.dxworks.exgraph.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.dxworks.exgraph.model.Graphs;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes graph artifacts as pretty-printed JSON with keys in lexicographic order, so equal
 * graphs always produce identical text.
 */
public class JsonRenderer {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();

    public String render(Graphs graphs) throws JsonProcessingException {
        return MAPPER.writeValueAsString(graphs);
    }

    public String render(Graphs graphs, GraphSelection selection) throws JsonProcessingException {
        if (selection == GraphSelection.ALL) {
            return render(graphs);
        }
        Map<String, Object> subset = new LinkedHashMap<>();
        switch (selection) {
            case MODULES:
                subset.put("modules", graphs.modules);
                subset.put("module_edges", graphs.moduleEdges);
                break;
            case CALLS:
                subset.put("call_nodes", graphs.callNodes);
                subset.put("call_edges", graphs.callEdges);
                break;
            case MODULE_CALLS:
                subset.put("modules", graphs.modules);
                subset.put("module_call_edges", graphs.moduleCallEdges);
                break;
            default:
                throw new IllegalArgumentException("Unsupported selection: " + selection);
        }
        return MAPPER.writeValueAsString(subset);
    }

    /**
     * Reads a full result written by {@link #render(Graphs)}. Missing sections read as empty.
     */
    public Graphs read(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, Graphs.class);
    }
}
