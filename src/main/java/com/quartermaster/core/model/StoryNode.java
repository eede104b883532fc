package com.quartermaster.core.model;

/**
 * A user story referenced by tasks for context. Stories carry no status of their own.
 */
public record StoryNode(String id, String prdId, String title) {

    public StoryNode {
        id = IdNormalizer.normalize(id);
        prdId = IdNormalizer.normalize(prdId);
    }
}
