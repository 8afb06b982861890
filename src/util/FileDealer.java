package util;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 读写文件的唯一出口, 全部按 UTF-8 处理; IO 错误抛给调用者
 */
public class FileDealer {

    private FileDealer() {
    }

    public static String readFile(String path) throws IOException {
        return Files.readString(Path.of(path), StandardCharsets.UTF_8);
    }

    public static String readStream(InputStream in) throws IOException {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }

    public static void outputToStream(CharSequence content, OutputStream s) throws IOException {
        Writer writer = new OutputStreamWriter(s, StandardCharsets.UTF_8);
        writer.append(content);
        writer.flush();
    }

    public static void outputToFile(CharSequence content, String path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(Path.of(path), StandardCharsets.UTF_8)) {
            writer.append(content);
        }
    }
}
