package com.astroslide.model;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

public final class PresetDefinition {

    public final String id;
    public final String name;
    public final String description;
    public final String bestFor;
    private final List<Stage> stages;
    private final SubjectMask subjectMask;

    public PresetDefinition(String id, String name, String description, String bestFor, List<Stage> stages) {
        this(id, name, description, bestFor, null, stages);
    }

    public PresetDefinition(String id, String name, String description, String bestFor,
                            SubjectMask subjectMask, List<Stage> stages) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.bestFor = bestFor;
        this.subjectMask = subjectMask;
        this.stages = Collections.unmodifiableList(List.copyOf(stages));
    }

    public List<Stage> getStages() {
        return stages;
    }

    /** Present when every stage is confined to the subject and the sky is blacked out. */
    public Optional<SubjectMask> getSubjectMask() {
        return Optional.ofNullable(subjectMask);
    }

    @Override
    public String toString() {
        return id + " (" + stages.size() + " stages" + (subjectMask != null ? ", masked" : "") + ")";
    }
}
