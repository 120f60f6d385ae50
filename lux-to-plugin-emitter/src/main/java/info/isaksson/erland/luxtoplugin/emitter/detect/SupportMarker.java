package info.isaksson.erland.luxtoplugin.emitter.detect;

import info.isaksson.erland.luxtoplugin.emitter.Backend;

import java.util.EnumSet;
import java.util.Set;

/** Support a generated file needs up front: imports, helper objects or shim functions. */
public enum SupportMarker {
    HASH_MAP(EnumSet.of(Backend.SWC)),
    HASH_SET(EnumSet.of(Backend.SWC)),
    JSON(EnumSet.of(Backend.BABEL, Backend.SWC)),
    FS(EnumSet.of(Backend.BABEL, Backend.SWC)),
    PATH(EnumSet.of(Backend.BABEL, Backend.SWC)),
    REGEX(EnumSet.of(Backend.SWC)),
    PARSER(EnumSet.of(Backend.BABEL, Backend.SWC)),
    CODEGEN(EnumSet.of(Backend.BABEL, Backend.SWC)),
    /** JavaScript has no macros; format!/vec!/... become calls to prelude functions. */
    MACRO_SHIMS(EnumSet.of(Backend.BABEL));

    private final Set<Backend> backends;

    SupportMarker(Set<Backend> backends) {
        this.backends = backends;
    }

    public boolean appliesTo(Backend backend) {
        return backends.contains(backend);
    }
}
