package com.pinotchat.mcp.filter;

/**
 * Outcome of a filter reload.
 *
 * @param oldCount Pattern count of the replaced revision (0 when it was unrestricted)
 * @param newCount Pattern count of the new revision (0 when it is unrestricted)
 * @param unrestricted Whether the new revision disables filtering
 */
public record ReloadResult(int oldCount, int newCount, boolean unrestricted) {
    public ReloadResult {
        if (oldCount < 0 || newCount < 0) {
            throw new IllegalArgumentException("Pattern counts cannot be negative");
        }
    }
}
