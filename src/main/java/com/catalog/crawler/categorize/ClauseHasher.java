package com.catalog.crawler.categorize;

import com.catalog.crawler.domain.PrerequisiteModels.Prerequisites;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

@Component
public class ClauseHasher {
    private final ObjectMapper objectMapper;

    public ClauseHasher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String hash(Prerequisites prerequisites) {
        try {
            String json = objectMapper.writeValueAsString(prerequisites == null ? Prerequisites.NONE : prerequisites);
            return DigestUtils.md5DigestAsHex(json.getBytes(StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize prerequisites " + prerequisites, e);
        }
    }
}
