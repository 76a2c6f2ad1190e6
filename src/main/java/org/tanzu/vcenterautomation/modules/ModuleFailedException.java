package org.tanzu.vcenterautomation.modules;

/**
 * Raised inside a module when the invocation cannot proceed: invalid parameters or a named
 * object that does not exist. The message is reported to the caller as is.
 */
public class ModuleFailedException extends RuntimeException {

    public ModuleFailedException(String message) {
        super(message);
    }
}
