package com.scholary.video.summarizer.gemini;

/**
 * Status and lifecycle calls against files already staged on the remote file service.
 *
 * <p>Both operations take the durable {@link RemoteFileHandle#name()}, never the file URI.
 */
public interface RemoteFileService {

  /**
   * Look up the current processing state of a file.
   *
   * @param name the durable file name
   * @return the reported status
   * @throws RemoteFileException if the lookup fails
   */
  RemoteFileStatus getStatus(String name);

  /**
   * Delete a file. Best effort: failures are logged and reported through the return value.
   *
   * @param name the durable file name
   * @return true if the service confirmed the deletion
   */
  boolean delete(String name);
}
