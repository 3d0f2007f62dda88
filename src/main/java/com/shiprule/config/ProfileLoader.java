package com.shiprule.config;

import com.shiprule.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads shipping profiles from YAML files.
 * <p>
 * Profiles are read from a {@code profiles} list, either at the root or under a
 * {@code shipping} key.
 */
public class ProfileLoader {

    private static final Logger log = LoggerFactory.getLogger(ProfileLoader.class);

    /**
     * Load profiles from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the profile file
     * @return Loaded profiles, in file order
     */
    public static List<ShippingProfile> load(String path) {
        log.info("Loading shipping profiles from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load shipping profiles from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static List<ShippingProfile> parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(inputStream);

        if (loaded == null) {
            throw new ConfigurationException("Shipping profile file is empty");
        }
        if (!(loaded instanceof Map<?, ?>)) {
            throw new ConfigurationException("Shipping profile file must contain a map at the root");
        }

        Map<String, Object> root = (Map<String, Object>) loaded;
        Map<String, Object> section = root.containsKey("shipping")
                ? (Map<String, Object>) root.get("shipping")
                : root;

        Object profilesObj = section == null ? null : section.get("profiles");
        if (profilesObj != null && !(profilesObj instanceof List<?>)) {
            throw new ConfigurationException("'profiles' must be a list");
        }

        List<ShippingProfile> profiles = ProfileParser.parseProfiles((List<?>) profilesObj);
        validate(profiles);

        long active = profiles.stream().filter(ShippingProfile::active).count();
        log.info("Loaded {} shipping profiles ({} active)", profiles.size(), active);
        return profiles;
    }

    private static void validate(List<ShippingProfile> profiles) {
        if (profiles.isEmpty()) {
            log.warn("No shipping profiles configured, every item will be reported as unmatched");
            return;
        }

        Set<String> ids = new HashSet<>();
        for (ShippingProfile profile : profiles) {
            if (!ids.add(profile.id())) {
                throw new ConfigurationException("Duplicate shipping profile id '" + profile.id() + "'");
            }
        }

        long defaults = profiles.stream()
                .filter(p -> p.active() && p.defaultProfile())
                .count();
        if (defaults > 1) {
            log.warn("{} active profiles are flagged default; the one with the lowest priority is used", defaults);
        }
    }
}
