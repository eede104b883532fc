package com.quartermaster.core.cascade;

import com.quartermaster.core.model.ArtefactStatus;

/**
 * One status write made by the cascade.
 *
 * @param kind artefact kind: "task", "epic" or "prd"
 * @param id   artefact id
 * @param from status before the write
 * @param to   status after the write
 */
public record StatusChange(String kind, String id, ArtefactStatus from, ArtefactStatus to) {}
