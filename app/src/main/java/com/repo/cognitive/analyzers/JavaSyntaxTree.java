package com.repo.cognitive.analyzers;

import com.repo.cognitive.tree.FileNode;
import com.repo.cognitive.tree.LocationResolver;

/**
 * A converted Java file together with the resolver for its positions.
 */
public record JavaSyntaxTree(FileNode root, LocationResolver resolver) {
}
