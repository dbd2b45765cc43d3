package com.example.jestadapter.report;

import com.example.jestadapter.model.LoadResult;
import com.example.jestadapter.model.TestResult;

/**
 * Receives the documents produced by the adapter.
 */
public interface ResultReporter {

    void reportLoadResult(LoadResult loadResult);

    void reportTestResult(TestResult testResult);
}
