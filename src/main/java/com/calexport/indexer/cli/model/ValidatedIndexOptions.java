package com.calexport.indexer.cli.model;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.List;

import com.calexport.indexer.model.ObjectKind;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps IndexCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedIndexOptions {
    List<Path> paths;
    Charset charset;
    ObjectKind kind;
    Path reportPath;
}
