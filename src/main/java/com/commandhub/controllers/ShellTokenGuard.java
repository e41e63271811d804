package com.commandhub.controllers;

import com.commandhub.ErrorCode;
import com.commandhub.HubException;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Requires the shared shell token on interactive endpoints when one is
 * configured. Accepts {@code X-Shell-Token} or {@code Authorization: Bearer}.
 */
public class ShellTokenGuard implements Controller {

    static final List<String> GUARDED_PATHS = List.of(
        "/command", "/api/command", "/chat", "/operations", "/operations/*", "/mcp", "/api/mcp-call");

    private final byte[] expected;

    public ShellTokenGuard(String token) {
        this.expected = token != null && !token.isBlank() ? token.trim().getBytes(StandardCharsets.UTF_8) : null;
    }

    public boolean isEnabled() {
        return expected != null;
    }

    @Override
    public void registerRoutes(Javalin app) {
        if (!isEnabled()) {
            return;
        }
        for (String path : GUARDED_PATHS) {
            app.before(path, this::check);
        }
    }

    private void check(Context ctx) {
        if (!accepts(presented(ctx))) {
            throw new HubException(ErrorCode.UNAUTHORIZED, "missing or invalid shell token");
        }
    }

    boolean accepts(String presented) {
        if (expected == null) {
            return true;
        }
        if (presented == null || presented.isBlank()) {
            return false;
        }
        return MessageDigest.isEqual(expected, presented.trim().getBytes(StandardCharsets.UTF_8));
    }

    private static String presented(Context ctx) {
        String header = ctx.header("X-Shell-Token");
        if (header != null && !header.isBlank()) {
            return header;
        }
        String auth = ctx.header("Authorization");
        if (auth != null && auth.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return auth.substring(7);
        }
        return null;
    }
}
