package com.purchasingpower.cora.service.impl;

import com.purchasingpower.cora.model.CallContext;
import com.purchasingpower.cora.model.ServiceType;
import com.purchasingpower.cora.model.sync.ChangedFile;
import com.purchasingpower.cora.service.GitRepositoryService;
import com.purchasingpower.cora.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevTree;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.AbstractTreeIterator;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class GitRepositoryServiceImpl implements GitRepositoryService {

    @Override
    public boolean isGitRepository(File checkoutDir) {
        if (checkoutDir == null || !checkoutDir.exists() || !checkoutDir.isDirectory()) {
            return false;
        }
        return new File(checkoutDir, ".git").exists();
    }

    @Override
    public Optional<CommitInfo> headCommit(File checkoutDir) {
        if (!isGitRepository(checkoutDir)) {
            return Optional.empty();
        }
        try (Git git = Git.open(checkoutDir); RevWalk walk = new RevWalk(git.getRepository())) {
            ObjectId head = git.getRepository().resolve("HEAD");
            if (head == null) {
                return Optional.empty();
            }
            RevCommit commit = walk.parseCommit(head);
            return Optional.of(new CommitInfo(head.getName(), Instant.ofEpochSecond(commit.getCommitTime())));
        } catch (IOException e) {
            log.error("Failed to read HEAD for: {}", checkoutDir, e);
            throw new RuntimeException("Failed to read HEAD commit", e);
        }
    }

    @Override
    public List<String> listTrackedFiles(File checkoutDir) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.GIT, "ListTrackedFiles", checkoutDir.getName(), log);
        call.logRequest("Walking HEAD tree", "Checkout", checkoutDir);

        try (Git git = Git.open(checkoutDir)) {
            Repository repository = git.getRepository();
            ObjectId head = repository.resolve("HEAD");
            List<String> paths = new ArrayList<>();
            if (head == null) {
                call.logResponse("No HEAD commit");
                return paths;
            }
            try (RevWalk walk = new RevWalk(repository); TreeWalk treeWalk = new TreeWalk(repository)) {
                RevCommit commit = walk.parseCommit(head);
                treeWalk.addTree(commit.getTree());
                treeWalk.setRecursive(true);
                while (treeWalk.next()) {
                    paths.add(treeWalk.getPathString());
                }
            }
            call.logResponse("HEAD tree walked", "Files", paths.size());
            return paths;

        } catch (IOException e) {
            call.logError("Failed to walk HEAD tree", e);
            throw new RuntimeException("Failed to list tracked files", e);
        }
    }

    @Override
    public List<ChangedFile> changedFilesBetween(File checkoutDir, String fromCommit, String toCommit) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.GIT, "DiffCommits", checkoutDir.getName(), log);
        call.logRequest("Diffing commits", "From", fromCommit, "To", toCommit);

        try (Git git = Git.open(checkoutDir)) {
            Repository repository = git.getRepository();
            AbstractTreeIterator oldTreeParser = prepareTreeParser(repository, fromCommit);
            AbstractTreeIterator newTreeParser = prepareTreeParser(repository, toCommit);

            List<DiffEntry> diffs = git.diff()
                    .setOldTree(oldTreeParser)
                    .setNewTree(newTreeParser)
                    .call();

            List<ChangedFile> changed = new ArrayList<>();
            for (DiffEntry diff : diffs) {
                switch (diff.getChangeType()) {
                    case ADD, COPY -> changed.add(new ChangedFile(diff.getNewPath(), ChangedFile.ChangeType.ADD));
                    case MODIFY -> changed.add(new ChangedFile(diff.getNewPath(), ChangedFile.ChangeType.MODIFY));
                    case DELETE -> changed.add(new ChangedFile(diff.getOldPath(), ChangedFile.ChangeType.DELETE));
                    case RENAME -> {
                        changed.add(new ChangedFile(diff.getOldPath(), ChangedFile.ChangeType.DELETE));
                        changed.add(new ChangedFile(diff.getNewPath(), ChangedFile.ChangeType.ADD));
                    }
                }
            }
            call.logResponse("Diff computed", "Changed", changed.size());
            return changed;

        } catch (IOException | GitAPIException e) {
            call.logError("Failed to compute diff", e);
            throw new RuntimeException("Failed to compute Git diff", e);
        }
    }

    private AbstractTreeIterator prepareTreeParser(Repository repository, String commitSha) throws IOException {
        try (RevWalk walk = new RevWalk(repository)) {
            ObjectId commitId = repository.resolve(commitSha);
            if (commitId == null) {
                throw new IOException("Unknown commit: " + commitSha);
            }
            RevCommit commit = walk.parseCommit(commitId);
            RevTree tree = walk.parseTree(commit.getTree().getId());

            CanonicalTreeParser treeParser = new CanonicalTreeParser();
            try (ObjectReader reader = repository.newObjectReader()) {
                treeParser.reset(reader, tree.getId());
            }
            return treeParser;
        }
    }
}
