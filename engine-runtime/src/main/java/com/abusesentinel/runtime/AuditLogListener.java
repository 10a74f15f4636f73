package com.abusesentinel.runtime;

import com.abusesentinel.core.engine.AnomalyListener;
import com.abusesentinel.core.engine.SubjectArchiver;
import com.abusesentinel.core.model.AnomalyEvent;
import com.abusesentinel.core.model.BehaviorAnalysis;
import com.abusesentinel.core.model.ViolationRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes anomaly events and archived subjects as one JSON document per line
 * to the {@value #AUDIT_LOGGER} logger.
 *
 * <p>
 * Route that logger to its own appender to obtain a machine-readable audit
 * trail; see {@code log4j2.xml}.
 * </p>
 */
public class AuditLogListener implements AnomalyListener, SubjectArchiver {

    public static final String AUDIT_LOGGER = "abuse-sentinel.audit";

    private static final Logger LOG = LoggerFactory.getLogger(AuditLogListener.class);
    private static final Logger AUDIT = LoggerFactory.getLogger(AUDIT_LOGGER);

    private final ObjectMapper mapper;

    public AuditLogListener() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    @Override
    public void onAnomaly(AnomalyEvent event) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("type", "anomaly");
        record.put("event", event);
        toJson(record).ifPresent(AUDIT::info);
    }

    @Override
    public void archive(String subjectId, BehaviorAnalysis analysis, List<ViolationRecord> violations) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("type", "archive");
        record.put("subjectId", subjectId);
        record.put("analysis", analysis);
        record.put("violations", violations);
        toJson(record).ifPresent(AUDIT::info);
    }

    /**
     * Serialize one audit record.
     *
     * @param record the record
     * @return the JSON text, or empty if serialization failed
     */
    Optional<String> toJson(Object record) {
        try {
            return Optional.of(mapper.writeValueAsString(record));
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize audit record: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }
}
