package com.shiprule.service;

import com.shiprule.config.ShippingProfile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of ProfileRepository.
 *
 * <p>Keeps insertion order so that equal priorities resolve the same way on every call.
 * All operations are thread-safe.
 */
public class InMemoryProfileRepository implements ProfileRepository {

    private final Map<String, ShippingProfile> profiles = new LinkedHashMap<>();

    public InMemoryProfileRepository() {
    }

    public InMemoryProfileRepository(List<ShippingProfile> initial) {
        loadProfiles(initial);
    }

    @Override
    public synchronized List<ShippingProfile> findAll() {
        return List.copyOf(profiles.values());
    }

    @Override
    public synchronized List<ShippingProfile> findActive() {
        List<ShippingProfile> active = new ArrayList<>();
        for (ShippingProfile profile : profiles.values()) {
            if (profile.active()) {
                active.add(profile);
            }
        }
        active.sort(Comparator.comparingInt(ShippingProfile::priority));
        return List.copyOf(active);
    }

    @Override
    public synchronized Optional<ShippingProfile> findById(String profileId) {
        return Optional.ofNullable(profiles.get(profileId));
    }

    @Override
    public synchronized String save(ShippingProfile profile) {
        profiles.put(profile.id(), profile);
        return profile.id();
    }

    @Override
    public synchronized boolean delete(String profileId) {
        return profiles.remove(profileId) != null;
    }

    /**
     * Replace all profiles (used for initial loading from the profile file).
     */
    public synchronized void loadProfiles(List<ShippingProfile> profileList) {
        profiles.clear();
        if (profileList != null) {
            for (ShippingProfile profile : profileList) {
                profiles.put(profile.id(), profile);
            }
        }
    }
}
