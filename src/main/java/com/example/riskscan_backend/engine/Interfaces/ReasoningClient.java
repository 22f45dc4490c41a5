package com.example.riskscan_backend.engine.Interfaces;

import java.util.List;

/**
 * Generative reasoning capability constrained to JSON output.
 */
public interface ReasoningClient {
    record Message(String role, String content) {
        public static Message system(String content) {
            return new Message("system", content);
        }

        public static Message user(String content) {
            return new Message("user", content);
        }

        public static Message assistant(String content) {
            return new Message("assistant", content);
        }
    }

    /** @return raw content of the model reply. */
    String complete(List<Message> messages);
}
