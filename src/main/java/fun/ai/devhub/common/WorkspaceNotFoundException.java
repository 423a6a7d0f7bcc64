package fun.ai.devhub.common;

public class WorkspaceNotFoundException extends DevHubException {
    private final String workspaceId;

    public WorkspaceNotFoundException(String workspaceId) {
        super(404, workspaceId == null ? "没有激活的 workspace，请先激活一个 workspace" : "workspace 不存在: " + workspaceId);
        this.workspaceId = workspaceId;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }
}
