package abrazar.casework.jobs;

import java.util.Arrays;
import java.util.Optional;

/**
 * Entity kinds an uploaded asset may be attached to.
 *
 * <p>
 * The asset folder is derived from the plural form ({@code abrazar/cases}, {@code abrazar/users}, ...).
 */
public enum UploadEntityType {

    CASE("case"),
    USER("user"),
    ORGANIZATION("organization");

    private final String key;

    UploadEntityType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public String getFolderName() {
        return key + "s";
    }

    public static Optional<UploadEntityType> fromKey(String key) {
        return Arrays.stream(values()).filter(t -> t.key.equals(key)).findFirst();
    }
}
