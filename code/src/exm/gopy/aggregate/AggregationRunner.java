/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.gopy.aggregate;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.log4j.Logger;

import exm.gopy.common.Logging;
import exm.gopy.common.exceptions.GopyRuntimeError;

/**
 * Summarizes files on a fixed pool of workers, then merges the per-file
 * results in a single combining step.  Results keep the order of the
 * input files.
 */
public class AggregationRunner {

  private static final Logger logger = Logging.getGopyLogger();

  private final int workers;

  public AggregationRunner(int workers) {
    this.workers = workers;
  }

  public List<SymbolSummary> run(List<File> files)
      throws IOException, InterruptedException {
    return MedianOfMedians.reduce(summarizeAll(files));
  }

  public List<List<SymbolSummary>> summarizeAll(List<File> files)
      throws IOException, InterruptedException {
    ExecutorService pool = Executors.newFixedThreadPool(workers);
    try {
      List<Future<List<SymbolSummary>>> futures =
          new ArrayList<Future<List<SymbolSummary>>>(files.size());
      for (final File file: files) {
        futures.add(pool.submit(new Callable<List<SymbolSummary>>() {
          @Override
          public List<SymbolSummary> call() throws IOException {
            return SymbolSummarizer.summarize(file);
          }
        }));
      }

      List<List<SymbolSummary>> results =
          new ArrayList<List<SymbolSummary>>(files.size());
      for (int i = 0; i < futures.size(); i++) {
        results.add(await(futures.get(i), files.get(i)));
      }
      logger.debug("summarized " + files.size() + " files on " +
                   workers + " workers");
      return results;
    } finally {
      pool.shutdownNow();
    }
  }

  private static List<SymbolSummary> await(
      Future<List<SymbolSummary>> future, File file)
          throws IOException, InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof IOException) {
        throw (IOException) cause;
      }
      throw new GopyRuntimeError("Summarizing " + file + " failed", cause);
    }
  }
}
