package com.scholary.chapters.grouping;

/** A single chapter of a sequence: its number and the file holding it. */
public record Chapter(int chapterNumber, FileDescriptor file) {}
