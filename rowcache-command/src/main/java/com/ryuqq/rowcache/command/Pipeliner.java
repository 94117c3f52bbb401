package com.ryuqq.rowcache.command;

import com.ryuqq.rowcache.command.result.Cmd;

import java.util.List;

/**
 * Batch of commands sent together.
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public interface Pipeliner extends Cmdable {

    /**
     * Sends the queued commands.
     *
     * @return results in queue order
     */
    List<Cmd<?>> exec();
}
