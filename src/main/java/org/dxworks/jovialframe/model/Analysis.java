package org.dxworks.jovialframe.model;

/**
 * Per-file record written by the command line tool.
 */
public interface Analysis {
    String getFilePath();
    String getLanguage();
}
