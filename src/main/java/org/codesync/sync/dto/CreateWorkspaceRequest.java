package org.codesync.sync.dto;

/**
 * 创建工作区请求。
 *
 * @param name      工作区名称
 * @param createdBy 创建者用户标识（身份校验由外部完成）
 */
public record CreateWorkspaceRequest(String name, String createdBy) {
}
