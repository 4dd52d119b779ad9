package com.learnflow.learnflow_backend.job;

import com.learnflow.learnflow_backend.model.roadmap.ContentType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ContentGeneratorRegistry {

    private final List<ContentGenerator> generators;
    private final Map<ContentType, ContentGenerator> registry = new EnumMap<>(ContentType.class);

    @PostConstruct
    public void init() {
        generators.forEach(generator -> registry.put(generator.supportedType(), generator));
    }

    public ContentGenerator get(ContentType type) {
        ContentGenerator generator = registry.get(type);
        if (generator == null) {
            throw new UnsupportedOperationException("No generator registered for content type: " + type.wireName());
        }
        return generator;
    }

    public boolean isSupported(ContentType type) {
        return registry.containsKey(type);
    }
}
