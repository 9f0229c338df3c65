/*
 * Copyright 2025 The Wikigit Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.wikigit.store;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.CommitBuilder;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectInserter;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.RefUpdate;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.lib.TreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link ObjectStore} backed by a git repository on disk, written with JGit.
 *
 * <p>Objects are buffered by a single inserter and flushed before a branch is created, so a branch
 * never points at objects that haven't been written.
 */
public final class GitObjectStore implements ObjectStore, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(GitObjectStore.class);

  /**
   * Git's tree order: names compare as unsigned bytes, with a tree's name treated as if it ended in
   * '/'.
   */
  @VisibleForTesting
  static final Comparator<TreeEntry> CANONICAL_ORDER = GitObjectStore::compareEntries;

  private final Repository repository;
  private final ObjectInserter inserter;
  private final String authorName;
  private final String authorEmail;

  private GitObjectStore(Repository repository, String authorName, String authorEmail) {
    this.repository = repository;
    this.inserter = repository.newObjectInserter();
    this.authorName = authorName;
    this.authorEmail = authorEmail;
  }

  /**
   * Creates a git repository in {@code directory} (or reopens the one that's there) and returns a
   * store that writes to it, signing commits as the given author.
   */
  public static GitObjectStore init(Path directory, String authorName, String authorEmail) {
    try {
      Git git = Git.init().setDirectory(directory.toFile()).call();
      logger.info("Writing to git repository {}", git.getRepository().getDirectory());
      return new GitObjectStore(git.getRepository(), authorName, authorEmail);
    } catch (GitAPIException e) {
      throw new ObjectStoreFailure("Cannot create repository in " + directory, e);
    }
  }

  /** The repository written by this store. */
  public Repository repository() {
    return repository;
  }

  @Override
  public ObjectHash putBlob(byte[] content) {
    try {
      return toHash(inserter.insert(Constants.OBJ_BLOB, content));
    } catch (IOException e) {
      throw new ObjectStoreFailure("Cannot store blob", e);
    }
  }

  @Override
  public ObjectHash putTree(List<TreeEntry> entries) {
    TreeFormatter formatter = new TreeFormatter();
    for (TreeEntry entry : ImmutableList.sortedCopyOf(CANONICAL_ORDER, entries)) {
      formatter.append(entry.name(), FileMode.fromBits(entry.mode().bits), toObjectId(entry.id()));
    }
    try {
      return toHash(inserter.insert(formatter));
    } catch (IOException e) {
      throw new ObjectStoreFailure("Cannot store tree", e);
    }
  }

  @Override
  public ObjectHash putCommit(ObjectHash tree, String message, List<ObjectHash> parents) {
    PersonIdent ident = new PersonIdent(authorName, authorEmail);
    CommitBuilder commit = new CommitBuilder();
    commit.setTreeId(toObjectId(tree));
    commit.setParentIds(parents.stream().map(GitObjectStore::toObjectId).toArray(ObjectId[]::new));
    commit.setAuthor(ident);
    commit.setCommitter(ident);
    commit.setMessage(message);
    try {
      return toHash(inserter.insert(commit));
    } catch (IOException e) {
      throw new ObjectStoreFailure("Cannot store commit", e);
    }
  }

  @Override
  public void setRef(String branch, ObjectHash commit) {
    String refName = Constants.R_HEADS + branch;
    try {
      if (repository.exactRef(refName) != null) {
        throw new ObjectStoreFailure("A branch named '" + branch + "' already exists");
      }
      inserter.flush();
      RefUpdate update = repository.updateRef(refName);
      update.setNewObjectId(toObjectId(commit));
      update.setExpectedOldObjectId(ObjectId.zeroId());
      update.setRefLogMessage("branch: Created from " + commit, false);
      RefUpdate.Result result = update.update();
      if (result != RefUpdate.Result.NEW) {
        throw new ObjectStoreFailure("Cannot create branch '" + branch + "': " + result);
      }
    } catch (IOException e) {
      throw new ObjectStoreFailure("Cannot create branch '" + branch + "'", e);
    }
  }

  /** Writes any buffered objects and releases the repository. */
  @Override
  public void close() {
    try {
      inserter.flush();
    } catch (IOException e) {
      throw new ObjectStoreFailure("Cannot flush objects", e);
    } finally {
      inserter.close();
      repository.close();
    }
  }

  private static ObjectHash toHash(ObjectId id) {
    return new ObjectHash(id.name());
  }

  private static ObjectId toObjectId(ObjectHash hash) {
    return ObjectId.fromString(hash.hex());
  }

  private static int compareEntries(TreeEntry a, TreeEntry b) {
    byte[] x = a.name().getBytes(UTF_8);
    byte[] y = b.name().getBytes(UTF_8);
    int common = Math.min(x.length, y.length);
    for (int i = 0; i < common; i++) {
      int cmp = Byte.toUnsignedInt(x[i]) - Byte.toUnsignedInt(y[i]);
      if (cmp != 0) {
        return cmp;
      }
    }
    return terminator(x, common, a.mode()) - terminator(y, common, b.mode());
  }

  private static int terminator(byte[] name, int pos, TreeEntry.Mode mode) {
    if (pos < name.length) {
      return Byte.toUnsignedInt(name[pos]);
    }
    return (mode == TreeEntry.Mode.TREE) ? '/' : 0;
  }
}
