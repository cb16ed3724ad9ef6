package com.example.agentflow.agent.tools;

import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Tool that returns the current time (ISO-8601), in UTC unless a zone is given.
 */
public class TimeTool {

    @Tool("Get the current date and time (ISO-8601). Zone is an IANA id such as Europe/Paris; empty means UTC.")
    public String currentTime(@P(value = "IANA time zone id", required = false) String zone) {
        ZoneId zoneId = ZoneOffset.UTC;
        if (zone != null && !zone.isBlank()) {
            try {
                zoneId = ZoneId.of(zone.trim());
            } catch (DateTimeException e) {
                return "Unknown time zone: " + zone.trim();
            }
        }
        return ZonedDateTime.now(zoneId).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
