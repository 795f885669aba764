package vantage.assist.guidance;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class GuidanceCatalog {
    private static final Logger log = LoggerFactory.getLogger(GuidanceCatalog.class);

    public static final String DEFAULT_LOCATION = "guidance/tool-guidance.json";

    private final Map<String, ToolGuidance> tools;
    private final List<String> order;

    public GuidanceCatalog(Collection<ToolGuidance> guidance) {
        Map<String, ToolGuidance> byName = new LinkedHashMap<>();
        for (ToolGuidance g : guidance) {
            if (byName.putIfAbsent(g.name(), g) != null) {
                throw new IllegalArgumentException("duplicate tool guidance: " + g.name());
            }
        }
        this.tools = Map.copyOf(byName);
        this.order = List.copyOf(byName.keySet());
    }

    public static GuidanceCatalog load(ObjectMapper objectMapper, String classpathLocation) {
        ClassLoader loader = GuidanceCatalog.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(classpathLocation)) {
            if (in == null) {
                throw new IllegalStateException("tool guidance not found on classpath: " + classpathLocation);
            }
            List<ToolGuidance> entries = objectMapper.readValue(in, new TypeReference<List<ToolGuidance>>() {});
            GuidanceCatalog catalog = new GuidanceCatalog(entries);
            log.info("Loaded {} tool guidance entries from {}", entries.size(), classpathLocation);
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read tool guidance from " + classpathLocation, e);
        }
    }

    public Optional<ToolGuidance> find(String tool) {
        if (tool == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(tool.trim().toLowerCase(Locale.ROOT)));
    }

    public ToolGuidance require(String tool) {
        return find(tool).orElseThrow(() -> new IllegalArgumentException("Unknown tool: " + tool));
    }

    public boolean contains(String tool) {
        return find(tool).isPresent();
    }

    public List<ToolGuidance> all() {
        List<ToolGuidance> result = new ArrayList<>(order.size());
        for (String name : order) {
            result.add(tools.get(name));
        }
        return result;
    }

    public List<String> supportedTools() {
        return order.stream().sorted().toList();
    }
}
