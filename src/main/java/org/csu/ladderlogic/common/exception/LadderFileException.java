package org.csu.ladderlogic.common.exception;

import java.nio.file.Path;

/**
 * @author hidyouth
 * @description: 输入文件无法读取或输出文件无法写入。
 * 异常信息中包含出错的文件路径以及底层 IO 异常的原因。
 */
public class LadderFileException extends RuntimeException {

    public LadderFileException(String message, Path path, Throwable cause) {
        super(message + ": " + path + (cause != null && cause.getMessage() != null ? " (" + cause.getMessage() + ")" : ""), cause);
    }
}
