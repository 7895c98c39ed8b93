package org.codesync.sync;

/**
 * 工作区路径规则：以 / 开头、/ 分隔；不允许空段、{@code .}、{@code ..}、反斜杠与结尾的 /。
 */
public final class WorkspacePaths {

    public static final int MAX_PATH_LENGTH = 1024;

    private WorkspacePaths() {
    }

    /**
     * 校验路径并原样返回；不合法时抛出 {@link SyncValidationException}。
     */
    public static String requireValid(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            throw new SyncValidationException("路径不能为空");
        }
        if (filePath.length() > MAX_PATH_LENGTH) {
            throw new SyncValidationException("路径过长（上限 " + MAX_PATH_LENGTH + " 字符）：" + filePath);
        }
        if (!filePath.startsWith("/") || filePath.equals("/")) {
            throw new SyncValidationException("路径必须以 / 开头且不能是根目录：" + filePath);
        }
        if (filePath.endsWith("/")) {
            throw new SyncValidationException("路径不能以 / 结尾：" + filePath);
        }
        if (filePath.indexOf('\\') >= 0) {
            throw new SyncValidationException("路径不能包含反斜杠：" + filePath);
        }
        for (String segment : filePath.substring(1).split("/", -1)) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                throw new SyncValidationException("路径包含非法片段：" + filePath);
            }
            for (int i = 0; i < segment.length(); i++) {
                if (Character.isISOControl(segment.charAt(i))) {
                    throw new SyncValidationException("路径包含控制字符：" + filePath);
                }
            }
        }
        return filePath;
    }
}
