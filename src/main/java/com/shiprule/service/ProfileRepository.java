package com.shiprule.service;

import com.shiprule.config.ShippingProfile;

import java.util.List;
import java.util.Optional;

/**
 * Access to stored shipping profiles.
 */
public interface ProfileRepository {

    /**
     * Get all profiles in the order they were stored.
     */
    List<ShippingProfile> findAll();

    /**
     * Get the active profiles ordered by ascending priority.
     * Equal priorities keep their stored order.
     */
    List<ShippingProfile> findActive();

    Optional<ShippingProfile> findById(String profileId);

    /**
     * Insert or replace a profile.
     *
     * @return Id of the stored profile
     */
    String save(ShippingProfile profile);

    boolean delete(String profileId);
}
