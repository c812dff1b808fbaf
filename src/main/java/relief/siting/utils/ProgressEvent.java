package relief.siting.utils;

import java.util.LinkedHashMap;
import java.util.Map;

// One progress update of a pipeline run, as returned by /optimize/progress
public class ProgressEvent {
    public String type; // "stage" or "round"
    public String stage;
    public String component;
    public String status; // starting, in_progress, completed, error
    public String message;
    public Map<String, Object> data;
    public long timestamp;

    public ProgressEvent() {}

    public ProgressEvent(String type, String stage, String component, String status, String message) {
        this.type = type;
        this.stage = stage;
        this.component = component;
        this.status = status;
        this.message = message;
        this.data = new LinkedHashMap<>();
        this.timestamp = System.currentTimeMillis();
    }

    public static ProgressEvent stage(String stage, String component, String status, String message) {
        return new ProgressEvent("stage", stage, component, status, message);
    }

    public ProgressEvent with(String key, Object value) {
        data.put(key, value);
        return this;
    }
}
