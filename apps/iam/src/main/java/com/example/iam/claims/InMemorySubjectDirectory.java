package com.example.iam.claims;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySubjectDirectory implements SubjectDirectory {

    private final ConcurrentHashMap<String, SubjectProfile> profiles = new ConcurrentHashMap<>();

    @Override
    public Optional<SubjectProfile> find(String subjectId) {
        return subjectId == null ? Optional.empty() : Optional.ofNullable(profiles.get(subjectId));
    }

    @Override
    public void save(SubjectProfile profile) {
        profiles.put(profile.subjectId(), profile);
    }
}
