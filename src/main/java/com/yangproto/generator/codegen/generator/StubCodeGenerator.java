package com.yangproto.generator.codegen.generator;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yangproto.generator.codegen.model.ProtoModule;
import com.yangproto.generator.codegen.model.RpcMethod;
import com.yangproto.generator.codegen.model.output.GeneratedFile;
import com.yangproto.generator.codegen.model.output.GeneratedFileType;
import com.yangproto.generator.codegen.model.output.OutputPathSet;
import com.yangproto.generator.codegen.util.NamingUtil;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the Java stubs that sit around the generated proto schemas:
 * <ul>
 *   <li>one gRPC server handler skeleton per module with rpcs,</li>
 *   <li>one registration class binding every handler,</li>
 *   <li>the translator seam handlers call through,</li>
 *   <li>one client dispatch program routing a method name to its typed call.</li>
 * </ul>
 * Templates live on the classpath under {@code /templates}.
 */
public class StubCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(StubCodeGenerator.class);

    static final String HANDLER_TEMPLATE = "server/handler.ftl";
    static final String REGISTRATION_TEMPLATE = "server/registration.ftl";
    static final String TRANSLATOR_TEMPLATE = "server/translator.ftl";
    static final String CLIENT_TEMPLATE = "client/main.ftl";

    private final Configuration freemarkerConfig;
    private final OutputPathSet outputPaths;
    private final String stubPackage;

    public StubCodeGenerator(OutputPathSet outputPaths, String stubPackage) {
        this.outputPaths = Objects.requireNonNull(outputPaths, "outputPaths");
        this.stubPackage = Objects.requireNonNull(stubPackage, "stubPackage");
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String serverPackage() {
        return stubPackage + ".server";
    }

    public String clientPackage(String prefix) {
        return stubPackage + ".client.gnoi_" + prefix + "_client";
    }

    /**
     * Handler skeleton for one module; only meaningful when the module has rpcs.
     */
    public GeneratedFile renderServerHandler(ProtoModule module) throws IOException {
        Map<String, Object> model = baseModel();
        model.put("module", moduleModel(module));
        model.put("rpcs", module.getRpcs());
        return GeneratedFile.builder()
                .path(outputPaths.serverHandlerFile(module))
                .contents(render(HANDLER_TEMPLATE, model))
                .type(GeneratedFileType.SERVER_HANDLER)
                .build();
    }

    public GeneratedFile renderRegistration(List<ProtoModule> modules, String prefix) throws IOException {
        Map<String, Object> model = baseModel();
        model.put("prefix", prefix);
        model.put("prefixPascal", NamingUtil.toPascalCase(prefix));
        model.put("modules", modules.stream().filter(ProtoModule::hasRpcs).map(this::moduleModel).toList());
        return GeneratedFile.builder()
                .path(outputPaths.registrationFile(prefix))
                .contents(render(REGISTRATION_TEMPLATE, model))
                .type(GeneratedFileType.REGISTRATION)
                .build();
    }

    public GeneratedFile renderTranslatorSupport() throws IOException {
        return GeneratedFile.builder()
                .path(outputPaths.translatorSupportFile())
                .contents(render(TRANSLATOR_TEMPLATE, baseModel()))
                .type(GeneratedFileType.TRANSLATOR_SUPPORT)
                .build();
    }

    public GeneratedFile renderClientDispatch(List<ProtoModule> modules, String prefix) throws IOException {
        List<RpcMethod> rpcs = modules.stream()
                .flatMap(m -> m.getRpcs().stream())
                .toList();

        Map<String, Object> model = baseModel();
        model.put("prefix", prefix);
        model.put("prefixPascal", NamingUtil.toPascalCase(prefix));
        model.put("clientPackage", clientPackage(prefix));
        model.put("rpcs", rpcs);
        return GeneratedFile.builder()
                .path(outputPaths.clientDispatchFile(prefix))
                .contents(render(CLIENT_TEMPLATE, model))
                .type(GeneratedFileType.CLIENT_DISPATCH)
                .build();
    }

    private Map<String, Object> baseModel() {
        Map<String, Object> model = new HashMap<>();
        model.put("serverPackage", serverPackage());
        model.put("protoPackageRoot", ProtoEmitter.PACKAGE_ROOT);
        return model;
    }

    private Map<String, Object> moduleModel(ProtoModule module) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("sourceName", module.getSourceName());
        m.put("pascalName", module.getPascalName());
        m.put("packageSegment", NamingUtil.toPackageSegment(module.getPlainName()));
        m.put("protoPackage", ProtoEmitter.protoPackage(module));
        m.put("serviceName", ProtoEmitter.serviceName(module));
        return m;
    }

    private String render(String templateName, Map<String, Object> model) throws IOException {
        log.debug("Rendering template {}", templateName);
        Template template = freemarkerConfig.getTemplate(templateName);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IllegalStateException("Failed to render template " + templateName + ": " + e.getMessage(), e);
        }
        return out.toString();
    }
}
