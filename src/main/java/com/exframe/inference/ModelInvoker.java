package com.exframe.inference;

/**
 * Opaque language-model capability. Retries and timeouts are the
 * implementation's concern, not the caller's.
 */
public interface ModelInvoker {
    ModelReply invoke(String query, String context, boolean showThinking);
}
