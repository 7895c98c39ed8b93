package org.codesync.sync.dto;

/**
 * 执行请求：针对已提交的工作区版本运行入口文件。
 *
 * @param entrypointFile 入口文件路径（必须是清单中的文件）
 * @param input          标准输入（可为空）
 * @param language       语言（为空时使用默认语言）
 */
public record ExecuteRequest(
        String entrypointFile,
        String input,
        String language
) {
}
