/**
 * TargetId.java
 *
 * 该文件定义了所有受支持的目标语言的有限枚举。
 * 每个枚举值携带对外使用的短标识符（与前端标签页、toolchains.json 中的键一致）以及固定的源文件扩展名。
 * 新增一个目标语言只需要新增一个枚举值，并在 LanguageProfiles 中补充对应的语言配置。
 */
package club.ppmc.battlescript.model;

import java.util.Arrays;
import java.util.Optional;

public enum TargetId {
    PY("py", ".py"),
    JS("js", ".js"),
    C("c", ".c"),
    CPP("cpp", ".cpp"),
    SWIFT("swift", ".swift"),
    OBJC("objc", ".m"),
    OBJCPP("objcpp", ".mm"),
    GO("go", ".go"),
    ASM("asm", ".s"),
    APPLESCRIPT("applescript", ".applescript");

    private final String id;
    private final String extension;

    TargetId(String id, String extension) {
        this.id = id;
        this.extension = extension;
    }

    public String id() {
        return id;
    }

    public String extension() {
        return extension;
    }

    public static Optional<TargetId> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase();
        return Arrays.stream(values()).filter(t -> t.id.equals(normalized)).findFirst();
    }

    /**
     * 按标识符解析目标语言。
     *
     * @param id 目标语言标识符，例如 "py"、"objcpp"。
     * @return 对应的枚举值。
     * @throws IllegalArgumentException 当标识符未知时。
     */
    public static TargetId fromId(String id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException("未知的目标语言: " + id));
    }
}
