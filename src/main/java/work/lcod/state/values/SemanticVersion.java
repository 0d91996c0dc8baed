package work.lcod.state.values;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Semantic version ({@code major.minor.patch[-preRelease][+build]}).
 */
public record SemanticVersion(int major, int minor, int patch, String preRelease, String build)
    implements Comparable<SemanticVersion> {

    private static final Pattern FORMAT = Pattern.compile(
        "^(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)(?:-([0-9A-Za-z.-]+))?(?:\\+([0-9A-Za-z.-]+))?$"
    );

    public SemanticVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version numbers must not be negative");
        }
        preRelease = preRelease == null || preRelease.isEmpty() ? null : preRelease;
        build = build == null || build.isEmpty() ? null : build;
    }

    public static SemanticVersion parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        Matcher matcher = FORMAT.matcher(raw.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a semantic version: " + raw);
        }
        return new SemanticVersion(
            Integer.parseInt(matcher.group(1)),
            Integer.parseInt(matcher.group(2)),
            Integer.parseInt(matcher.group(3)),
            matcher.group(4),
            matcher.group(5)
        );
    }

    @Override
    public int compareTo(SemanticVersion other) {
        int result = Integer.compare(major, other.major);
        if (result == 0) {
            result = Integer.compare(minor, other.minor);
        }
        if (result == 0) {
            result = Integer.compare(patch, other.patch);
        }
        if (result != 0) {
            return result;
        }
        // a release sorts after any of its pre-releases
        if (preRelease == null || other.preRelease == null) {
            return preRelease == null ? (other.preRelease == null ? 0 : 1) : -1;
        }
        return preRelease.compareTo(other.preRelease);
    }

    @Override
    public String toString() {
        var builder = new StringBuilder().append(major).append('.').append(minor).append('.').append(patch);
        if (preRelease != null) {
            builder.append('-').append(preRelease);
        }
        if (build != null) {
            builder.append('+').append(build);
        }
        return builder.toString();
    }
}
