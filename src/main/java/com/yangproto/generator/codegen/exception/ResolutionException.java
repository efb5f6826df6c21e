package com.yangproto.generator.codegen.exception;

/**
 * A type, typedef, import prefix or leafref target could not be resolved.
 * Fatal: the run stops and nothing is written.
 */
public class ResolutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final String nodePath;

    public ResolutionException(String nodePath, String message) {
        super(message + " [at " + nodePath + "]");
        this.nodePath = nodePath;
    }

    /**
     * Schema path of the offending node.
     */
    public String getNodePath() {
        return nodePath;
    }
}
