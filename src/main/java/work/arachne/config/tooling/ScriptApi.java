package work.arachne.config.tooling;

import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.arachne.config.runtime.ConfigScope;
import work.arachne.config.store.ConfigGraph;
import work.arachne.config.store.EntityRef;
import work.arachne.config.store.LookupRef;
import work.arachne.config.store.TempId;
import work.arachne.config.store.TxData;

/**
 * The {@code config} object seen by scripts. Every member reads or updates the config scope in
 * context, so calling them outside of an initializer fails the same way DSL forms do.
 */
public final class ScriptApi {
    private static final Logger log = LoggerFactory.getLogger(ScriptApi.class);

    private final String namespace;

    ScriptApi(String namespace) {
        this.namespace = namespace;
    }

    @HostAccess.Export
    public ConfigGraph graph() {
        return ConfigScope.currentGraph();
    }

    @HostAccess.Export
    public void transact(Value txdata) {
        ConfigScope.transact(TxData.parse(ScriptValues.toJava(txdata)));
    }

    @HostAccess.Export
    public EntityRef transact(Value txdata, String tempid) {
        return ConfigScope.transact(TxData.parse(ScriptValues.toJava(txdata)), TempId.of(tempid)).orElse(null);
    }

    @HostAccess.Export
    public EntityRef resolveId(String aid) {
        return ConfigScope.resolveId(aid);
    }

    @HostAccess.Export
    public Object attr(Value entity, String attribute) {
        Object target = ScriptValues.toJava(entity);
        if (target instanceof String aid) {
            target = LookupRef.aid(aid);
        }
        return ConfigScope.attr(target, attribute).orElse(null);
    }

    @HostAccess.Export
    public void log(Object message) {
        log.atInfo().addKeyValue("namespace", namespace).log(String.valueOf(message));
    }

    @HostAccess.Export
    public String namespace() {
        return namespace;
    }
}
