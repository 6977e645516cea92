package me.golemcore.orchestrator.domain.recovery;

/**
 * Names of the tool families the recovery heuristics reason about. The tools
 * themselves are supplied by the host; only their names are known here.
 */
public final class ToolNames {

    public static final String READ_FILE = "read_file";
    public static final String WRITE_FILE = "write_file";
    public static final String EDIT_FILE = "edit_file";
    public static final String GLOB = "glob";
    public static final String GREP = "grep";
    public static final String SEARCH_CODE = "search_code";
    public static final String LIST_DIRECTORY = "list_directory";

    private ToolNames() {
    }
}
