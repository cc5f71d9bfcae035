package com.example.cachesync.error;

import java.util.List;

/**
 * An upstream response was well-formed but lacked attributes the pipeline relies on.
 */
public class SchemaException extends PipelineException {

    private final List<String> absentAttributes;

    public SchemaException(String message, List<String> absentAttributes) {
        super(ErrorKind.SCHEMA, message);
        this.absentAttributes = List.copyOf(absentAttributes);
    }

    public List<String> getAbsentAttributes() {
        return absentAttributes;
    }
}
