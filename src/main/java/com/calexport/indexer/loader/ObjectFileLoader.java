package com.calexport.indexer.loader;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calexport.indexer.config.IndexerConfig;
import com.calexport.indexer.model.CalObject;
import com.calexport.indexer.parser.ObjectParser;
import com.calexport.indexer.parser.exception.ObjectParseException;
import com.calexport.indexer.query.IndexContext;

/**
 * Reads export files into an {@link IndexContext}. Each object is parsed on its own; an object
 * that fails to parse is recorded as a {@link LoadFailure} and the rest of the stream still loads.
 */
public class ObjectFileLoader {
    private static final Logger log = LoggerFactory.getLogger(ObjectFileLoader.class);

    private final IndexContext context;
    private final ObjectTextSplitter splitter;
    private final ObjectParser parser;

    public ObjectFileLoader(IndexContext context) {
        this(context, new ObjectTextSplitter(), new ObjectParser());
    }

    public ObjectFileLoader(IndexContext context, ObjectTextSplitter splitter, ObjectParser parser) {
        this.context = context;
        this.splitter = splitter;
        this.parser = parser;
    }

    /**
     * A file is loaded as is; a directory is walked for files matching the configured glob.
     */
    public List<LoadResult> load(Path path) throws IOException {
        if (Files.isDirectory(path)) {
            return loadDirectory(path);
        }
        return List.of(loadFile(path));
    }

    public LoadResult loadFile(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        return load(file.toString(), decode(file, bytes, context.getConfig().getCharset()), bytes.length);
    }

    public List<LoadResult> loadDirectory(Path directory) throws IOException {
        IndexerConfig config = context.getConfig();
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + config.getFilePattern());
        int depth = config.isRecursive() ? Integer.MAX_VALUE : 1;
        List<Path> files;
        try (Stream<Path> stream = Files.walk(directory, depth)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(p.getFileName()))
                    .sorted()
                    .toList();
        }
        log.info("Found {} file(s) matching '{}' under {}", files.size(), config.getFilePattern(), directory);

        List<LoadResult> results = new ArrayList<>();
        for (Path file : files) {
            try {
                results.add(loadFile(file));
            } catch (IOException e) {
                LoadFailure failure = new LoadFailure(file.toString(), -1, "", "Could not read file: " + e.getMessage());
                log.warn("Skipped file: {}", failure.describe());
                LoadResult unreadable = LoadResult.builder()
                        .source(file.toString())
                        .failure(failure)
                        .build();
                context.record(unreadable);
                results.add(unreadable);
            }
        }
        return results;
    }

    public LoadResult loadText(String source, String content) {
        return load(source, content, content == null ? 0 : content.getBytes(context.getConfig().getCharset()).length);
    }

    private LoadResult load(String source, String content, long bytes) {
        List<String> texts = splitter.split(content);
        LoadResult.LoadResultBuilder result = LoadResult.builder()
                .source(source)
                .objectsFound(texts.size())
                .bytes(bytes);

        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            try {
                CalObject object = parser.parse(text);
                context.getDatabase().insert(object);
                result.loaded(object.getKey());
            } catch (ObjectParseException e) {
                LoadFailure failure = new LoadFailure(source, i, headerLine(text), e.getMessage());
                log.warn("Skipped object: {}", failure.describe());
                result.failure(failure);
            }
        }

        LoadResult built = result.build();
        context.record(built);
        log.info("Loaded {} of {} object(s) from {}", built.getObjectsLoaded(), built.getObjectsFound(), source);
        return built;
    }

    /**
     * Bytes that are not valid in the configured charset are replaced rather than failing the file.
     */
    private static String decode(Path file, byte[] bytes, Charset charset) {
        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.warn("{} is not valid {}, undecodable bytes replaced: {}", file, charset.name(), e.toString());
            return new String(bytes, charset);
        }
    }

    private static String headerLine(String text) {
        int newline = text.indexOf('\n');
        return (newline < 0 ? text : text.substring(0, newline)).strip();
    }
}
