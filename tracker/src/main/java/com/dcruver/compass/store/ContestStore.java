package com.dcruver.compass.store;

import com.dcruver.compass.model.Contest;

import java.util.Map;

/**
 * The contest collection.
 */
public class ContestStore extends RecordStore<Contest> {

    private final ContestNormalizer normalizer;

    public ContestStore(ContainerFile container, JsonRecordCodec codec, ContestNormalizer normalizer) {
        super(container, codec);
        this.normalizer = normalizer;
    }

    @Override
    protected Migration<Contest> migrate(Map<String, Object> raw) {
        return normalizer.normalize(raw);
    }

    @Override
    protected String idOf(Contest record) {
        return record.getId();
    }

    @Override
    protected String kind() {
        return "contest";
    }
}
