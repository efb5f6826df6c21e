package com.yangproto.generator.codegen.model.output;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

import com.yangproto.generator.codegen.model.ProtoModule;
import com.yangproto.generator.codegen.util.NamingUtil;

/**
 * Well-known output locations of a compiler run.
 */
@Value
@Builder(toBuilder = true)
public class OutputPathSet {

    @NonNull
    Path protoDir;

    @NonNull
    Path serverStubDir;

    @NonNull
    Path clientStubDir;

    /**
     * {@code <proto-dir>/<module>/<module>.proto}
     */
    public Path protoFile(ProtoModule module) {
        return protoDir.resolve(module.getPlainName()).resolve(module.getPlainName() + ".proto");
    }

    /**
     * {@code <server-dir>/<module>/<Module>ServiceHandler.java}
     */
    public Path serverHandlerFile(ProtoModule module) {
        return serverStubDir.resolve(module.getPlainName()).resolve(module.getPascalName() + "ServiceHandler.java");
    }

    public Path registrationFile(String prefix) {
        return serverStubDir.resolve(NamingUtil.toPascalCase(prefix) + "ServiceRegistration.java");
    }

    public Path translatorSupportFile() {
        return serverStubDir.resolve("YangRpcTranslator.java");
    }

    /**
     * {@code <client-dir>/gnoi_<prefix>_client/<Prefix>ClientMain.java}
     */
    public Path clientDispatchFile(String prefix) {
        return clientStubDir.resolve("gnoi_" + prefix + "_client")
                .resolve(NamingUtil.toPascalCase(prefix) + "ClientMain.java");
    }
}
