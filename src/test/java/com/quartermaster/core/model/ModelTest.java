package com.quartermaster.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("IdNormalizer")
    class IdNormalizerTests {

        @Test
        @DisplayName("pads task, epic and story ids to three digits")
        void padsIds() {
            assertEquals("T001", IdNormalizer.normalize("t1"));
            assertEquals("T001", IdNormalizer.normalize("T0001"));
            assertEquals("T042", IdNormalizer.normalize(" T42 "));
            assertEquals("E002", IdNormalizer.normalize("e2"));
            assertEquals("S010", IdNormalizer.normalize("S10"));
        }

        @Test
        @DisplayName("normalises PRD ids with or without the dash")
        void normalisesPrdIds() {
            assertEquals("PRD-001", IdNormalizer.normalize("prd1"));
            assertEquals("PRD-001", IdNormalizer.normalize("PRD-0001"));
        }

        @Test
        @DisplayName("keeps every digit of ids too long for a long")
        void keepsLongIds() {
            assertEquals("T99999999999999999999", IdNormalizer.normalize("T99999999999999999999"));
            assertEquals("T123456789012345678901", IdNormalizer.normalize("t000123456789012345678901"));
            assertEquals("T000", IdNormalizer.normalize("T0000"));
        }

        @Test
        @DisplayName("keeps ids of unknown shape, trimmed")
        void keepsUnknownIds() {
            assertEquals("FOO-9", IdNormalizer.normalize("  FOO-9 "));
            assertNull(IdNormalizer.normalize(null));
        }

        @Test
        @DisplayName("extracts PRD and epic from a parent reference")
        void extractsFromParent() {
            assertEquals("PRD-001", IdNormalizer.extractPrdId("PRD-001 / E002"));
            assertEquals("E002", IdNormalizer.extractEpicId("PRD-001 / E002"));
            assertNull(IdNormalizer.extractEpicId("PRD-001"));
            assertNull(IdNormalizer.extractPrdId(null));
        }
    }

    @Nested
    @DisplayName("ArtefactStatus")
    class ArtefactStatusTests {

        @Test
        @DisplayName("parses labels ignoring case, spaces, dashes and underscores")
        void parsesLabels() {
            assertEquals(ArtefactStatus.NOT_STARTED, ArtefactStatus.parse("Not Started"));
            assertEquals(ArtefactStatus.NOT_STARTED, ArtefactStatus.parse("not_started"));
            assertEquals(ArtefactStatus.IN_PROGRESS, ArtefactStatus.parse("in-progress"));
            assertEquals(ArtefactStatus.AUTO_DONE, ArtefactStatus.parse("Auto-Done"));
        }

        @Test
        @DisplayName("maps common aliases")
        void mapsAliases() {
            assertEquals(ArtefactStatus.NOT_STARTED, ArtefactStatus.parse("todo"));
            assertEquals(ArtefactStatus.IN_PROGRESS, ArtefactStatus.parse("WIP"));
            assertEquals(ArtefactStatus.DONE, ArtefactStatus.parse("completed"));
            assertEquals(ArtefactStatus.CANCELLED, ArtefactStatus.parse("canceled"));
        }

        @Test
        @DisplayName("unrecognised text becomes UNKNOWN")
        void unknown() {
            assertEquals(ArtefactStatus.UNKNOWN, ArtefactStatus.parse("someday"));
            assertEquals(ArtefactStatus.UNKNOWN, ArtefactStatus.parse(null));
        }

        @Test
        @DisplayName("only Done and Cancelled are finished; Auto-Done counts for roll-up")
        void finished() {
            assertTrue(ArtefactStatus.DONE.isFinished());
            assertTrue(ArtefactStatus.CANCELLED.isFinished());
            assertFalse(ArtefactStatus.AUTO_DONE.isFinished());
            assertTrue(ArtefactStatus.AUTO_DONE.isFinishedOrAutoDone());
            assertFalse(ArtefactStatus.IN_PROGRESS.isFinishedOrAutoDone());
        }

        @Test
        @DisplayName("epic and PRD statuses are not task statuses")
        void taskStatuses() {
            assertTrue(ArtefactStatus.BLOCKED.isTaskStatus());
            assertFalse(ArtefactStatus.DRAFT.isTaskStatus());
            assertFalse(ArtefactStatus.AUTO_DONE.isTaskStatus());
        }
    }

    @Nested
    @DisplayName("AgentStatus")
    class AgentStatusTests {

        @Test
        @DisplayName("a live agent can finish, be killed or be rejected")
        void liveTransitions() {
            assertTrue(AgentStatus.SPAWNED.canTransitionTo(AgentStatus.RUNNING));
            assertTrue(AgentStatus.RUNNING.canTransitionTo(AgentStatus.COMPLETED));
            assertTrue(AgentStatus.RUNNING.canTransitionTo(AgentStatus.KILLED));
            assertFalse(AgentStatus.RUNNING.canTransitionTo(AgentStatus.REAPED));
        }

        @Test
        @DisplayName("rejected is final; reaped and killed can only be rejected")
        void finalStates() {
            for (AgentStatus next : AgentStatus.values()) {
                assertFalse(AgentStatus.REJECTED.canTransitionTo(next));
                assertEquals(next == AgentStatus.REJECTED, AgentStatus.REAPED.canTransitionTo(next));
                assertEquals(next == AgentStatus.REJECTED, AgentStatus.KILLED.canTransitionTo(next));
            }
            assertTrue(AgentStatus.REAPED.isTerminal());
            assertFalse(AgentStatus.ERROR.isTerminal());
        }
    }

    @Nested
    @DisplayName("TaskNode")
    class TaskNodeTests {

        @Test
        @DisplayName("derives epic and PRD from the parent reference")
        void derivesHierarchy() {
            var task = new TaskNode("t7", "Add login", ArtefactStatus.NOT_STARTED, null,
                    "PRD-001 / E002", null, null, null);

            assertEquals("T007", task.id());
            assertEquals("E002", task.epicId());
            assertEquals("PRD-001", task.prdId());
            assertEquals(List.of(), task.blockedBy());
        }

        @Test
        @DisplayName("explicit epic and PRD ids win over the parent reference")
        void explicitIdsWin() {
            var task = new TaskNode("T1", null, null, List.of("T2"), "PRD-001 / E002", "e9", "prd9", List.of());

            assertEquals("E009", task.epicId());
            assertEquals("PRD-009", task.prdId());
            assertEquals(ArtefactStatus.UNKNOWN, task.status());
        }
    }

    @Nested
    @DisplayName("AgentRecord")
    class AgentRecordTests {

        @Test
        @DisplayName("pid is held only while the agent is active")
        void pidOnlyWhileActive() {
            var record = AgentRecord.spawned("T001", 4242L, null, "m.yaml", "run.log", 600, MergeStrategy.MERGE);
            assertEquals(AgentStatus.SPAWNED, record.status());
            assertEquals(4242L, record.pid());

            var exited = record.exited(0);
            assertEquals(AgentStatus.COMPLETED, exited.status());
            assertNull(exited.pid());
            assertEquals(0, exited.exitCode());

            var killed = record.killed();
            assertEquals(AgentStatus.KILLED, killed.status());
            assertNull(killed.pid());
            assertNotNull(killed.killedAt());
        }

        @Test
        @DisplayName("non-zero exit is an error")
        void nonZeroExit() {
            var record = AgentRecord.spawned("T001", 1L, null, null, null, 60, null).exited(3);
            assertEquals(AgentStatus.ERROR, record.status());
        }

        @Test
        @DisplayName("rejection drops the worktree and keeps the reason")
        void rejection() {
            var worktree = new WorktreeInfo("/tmp/wt/T001", "task/T001", "main", BranchingStrategy.FLAT);
            var record = AgentRecord.spawned("T001", 1L, worktree, null, null, 60, null)
                    .exited(0)
                    .rejected("wrong approach");

            assertEquals(AgentStatus.REJECTED, record.status());
            assertEquals("wrong approach", record.rejectReason());
            assertFalse(record.hasWorktree());
        }
    }

    @Nested
    @DisplayName("Enums with lenient parsing")
    class ParsingTests {

        @Test
        @DisplayName("BranchingStrategy, MergeStrategy and ResultStatus parse case-insensitively")
        void parse() {
            assertEquals(BranchingStrategy.PRD, BranchingStrategy.parse("prd"));
            assertEquals(MergeStrategy.SQUASH, MergeStrategy.parse("Squash"));
            assertEquals(MergeStrategy.MERGE, MergeStrategy.parse(null));
            assertEquals(ResultStatus.BLOCKED, ResultStatus.parse("blocked"));
            assertEquals(ResultStatus.FAILED, ResultStatus.parse("error"));
            assertTrue(ResultStatus.parse("completed").isSuccess());
        }

        @Test
        @DisplayName("ResultStatus treats only completed or a missing status as success")
        void unknownResultStatusIsNotSuccess() {
            assertEquals(ResultStatus.COMPLETED, ResultStatus.parse(null));
            assertEquals(ResultStatus.COMPLETED, ResultStatus.parse(" "));
            assertEquals(ResultStatus.COMPLETED, ResultStatus.parse("Completed"));
            assertEquals(ResultStatus.BLOCKED, ResultStatus.parse("incomplete"));
            assertEquals(ResultStatus.BLOCKED, ResultStatus.parse("partial"));
            assertFalse(ResultStatus.parse("done?").isSuccess());
        }
    }
}
