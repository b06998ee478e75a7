package io.chkfs.command.chk.subcommands;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.chkfs.tree.ChkConstants;
import io.chkfs.tree.ChkTreeShape;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/// Prints the tree geometry for a content size: depth, and the span and block count of each level.
@Command(
    name = "shape",
    description = "Show the CHK tree shape for a content size"
)
public class CMD_chk_shape implements Callable<Integer> {

    @Parameters(index = "0", description = "Content size in bytes")
    private long size;

    @Option(names = {"--fan-out"},
        description = "Children per internal block; the leaf size follows as fan-out * 128 (default: ${DEFAULT-VALUE})",
        defaultValue = "" + ChkConstants.FAN_OUT)
    private int fanOut = ChkConstants.FAN_OUT;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        ChkTreeShape shape;
        try {
            shape = new ChkTreeShape(size, fanOut);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: " + e.getMessage());
        }
        System.out.printf("size:      %d%n", shape.getTotalContentSize());
        System.out.printf("leaf size: %d%n", shape.getLeafSize());
        System.out.printf("fan-out:   %d%n", shape.getFanOut());
        System.out.printf("depth:     %d%n", shape.getDepth());
        System.out.printf("blocks:    %d%n", shape.getTotalBlockCount());
        for (int depth = shape.getDepth() - 1; depth >= 0; depth--) {
            System.out.printf("level %d: span=%d blocks=%d%n",
                depth, shape.getSpanAtDepth(depth), shape.getBlockCountAtDepth(depth));
        }
        return 0;
    }
}
