package io.github.byzatic.cronengine.run_record;

import java.util.List;

/**
 * Partial update for {@link JsonRunRecordStore#upsertRecord}: only non-null fields are applied.
 */
public final class RecordUpdate {
    final String cadence;
    final String model;
    final String modelOverride;
    final List<String> purposeTags;
    final Boolean disabled;

    private RecordUpdate(Builder b) {
        this.cadence = b.cadence;
        this.model = b.model;
        this.modelOverride = b.modelOverride;
        this.purposeTags = b.purposeTags == null ? null : List.copyOf(b.purposeTags);
        this.disabled = b.disabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    void applyTo(RunRecord record) {
        if (cadence != null) record.setCadence(cadence);
        if (model != null) record.setModel(model);
        if (modelOverride != null) record.setModelOverride(modelOverride);
        if (purposeTags != null) record.setPurposeTags(purposeTags);
        if (disabled != null) record.setDisabled(disabled);
    }

    public static final class Builder {
        private String cadence;
        private String model;
        private String modelOverride;
        private List<String> purposeTags;
        private Boolean disabled;

        public Builder cadence(String cadence) {
            this.cadence = cadence;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder modelOverride(String modelOverride) {
            this.modelOverride = modelOverride;
            return this;
        }

        public Builder purposeTags(List<String> purposeTags) {
            this.purposeTags = purposeTags;
            return this;
        }

        public Builder disabled(boolean disabled) {
            this.disabled = disabled;
            return this;
        }

        public RecordUpdate build() {
            return new RecordUpdate(this);
        }
    }
}
