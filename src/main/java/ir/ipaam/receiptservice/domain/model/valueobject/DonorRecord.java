package ir.ipaam.receiptservice.domain.model.valueobject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class DonorRecord {

    public static final String FIRST_NAME = "First Name";
    public static final String LAST_NAME = "Last Name";

    private final Map<String, String> fields;

    private DonorRecord(Map<String, String> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static DonorRecord of(Map<String, ?> values) {
        Map<String, String> copy = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((k, v) -> {
                if (k != null) copy.put(k, v == null ? "" : String.valueOf(v));
            });
        }
        return new DonorRecord(copy);
    }

    public Optional<String> get(String field) {
        return Optional.ofNullable(fields.get(field));
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public Map<String, String> fields() {
        return fields;
    }

    public String firstName() {
        return fields.getOrDefault(FIRST_NAME, "").trim();
    }

    public String lastName() {
        return fields.getOrDefault(LAST_NAME, "").trim();
    }

    public String displayName() {
        String name = (firstName() + " " + lastName()).trim();
        return name.isEmpty() ? "<unnamed donor>" : name;
    }

    @Override
    public String toString() {
        return "DonorRecord" + fields;
    }
}
