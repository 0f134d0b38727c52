package org.csu.ladderlogic.cli;

import org.csu.ladderlogic.common.exception.LadderFileException;
import org.csu.ladderlogic.config.LadderProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * @author hidyouth
 * @description: 读取逻辑描述文件, 写出梯形图文件
 */
@Component
public class LadderFileService {

    private final Charset charset;

    public LadderFileService(LadderProperties properties) {
        this.charset = Charset.forName(properties.getCharset());
    }

    public List<String> readLines(Path input) {
        try {
            return Files.readAllLines(input, charset);
        } catch (IOException e) {
            throw new LadderFileException("Error reading input file", input, e);
        }
    }

    public void write(Path output, String content) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, content, charset);
        } catch (IOException e) {
            throw new LadderFileException("Error writing output file", output, e);
        }
    }
}
