package com.example.shiftrota.schedule;

import com.example.shiftrota.exception.ScheduleFormatException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ingestion boundary between the stored JSON document and the typed {@link Schedule}.
 * Everything past this class works on typed records only.
 */
public final class ScheduleDocumentCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ScheduleDocumentCodec() {
    }

    public static String write(Schedule schedule) {
        try {
            return MAPPER.writeValueAsString(schedule);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Schedule could not be serialized", e);
        }
    }

    public static Schedule read(String json) throws ScheduleFormatException {
        if (json == null || json.isBlank()) {
            throw new ScheduleFormatException("Schedule document is empty");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ScheduleFormatException("Schedule document is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return fromTree(root);
    }

    public static Schedule fromTree(JsonNode root) throws ScheduleFormatException {
        if (root == null || !root.isObject()) {
            throw new ScheduleFormatException("Schedule document must be an object keyed by month");
        }
        Schedule.Builder builder = Schedule.builder();
        Iterator<Map.Entry<String, JsonNode>> monthFields = root.fields();
        while (monthFields.hasNext()) {
            Map.Entry<String, JsonNode> month = monthFields.next();
            if (!month.getValue().isObject()) {
                throw new ScheduleFormatException("Month '" + month.getKey() + "' must be an object keyed by shift");
            }
            Map<String, ShiftAssignment> shifts = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> shiftFields = month.getValue().fields();
            while (shiftFields.hasNext()) {
                Map.Entry<String, JsonNode> shift = shiftFields.next();
                String where = month.getKey() + " / " + shift.getKey();
                if (!shift.getValue().isObject()) {
                    throw new ScheduleFormatException("Shift " + where + " must be an object");
                }
                shifts.put(shift.getKey(), new ShiftAssignment(
                        readPeople(shift.getValue().get("assigned_staff"), where + " assigned_staff"),
                        readPeople(shift.getValue().get("floaters"), where + " floaters")));
            }
            builder.month(month.getKey(), shifts);
        }
        return builder.build();
    }

    private static List<EmployeeRef> readPeople(JsonNode node, String where) throws ScheduleFormatException {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ScheduleFormatException(where + " must be a list");
        }
        List<EmployeeRef> people = new ArrayList<>();
        for (JsonNode person : node) {
            JsonNode name = person.get("name");
            if (!person.isObject() || name == null || !name.isTextual() || name.asText().isBlank()) {
                throw new ScheduleFormatException(where + " contains an entry without a name");
            }
            JsonNode designation = person.get("designation");
            people.add(new EmployeeRef(name.asText(), designation == null || designation.isNull() ? "" : designation.asText()));
        }
        return people;
    }
}
