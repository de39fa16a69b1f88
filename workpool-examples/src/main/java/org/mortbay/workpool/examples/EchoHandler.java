//
// ========================================================================
// Copyright (c) 1995-2022 Mort Bay Consulting Pty Ltd and others.
//
// This program and the accompanying materials are made available under the
// terms of the Eclipse Public License v. 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
// which is available at https://www.apache.org/licenses/LICENSE-2.0.
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//

package org.mortbay.workpool.examples;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes back every line it reads, until the client closes its side.
 */
public class EchoHandler implements ConnectionHandler
{
    private static final Logger LOG = LoggerFactory.getLogger(EchoHandler.class);

    @Override
    public void handle(Socket socket) throws IOException
    {
        BufferedReader in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        Writer out = new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8);
        int lines = 0;
        String line;
        while ((line = in.readLine()) != null)
        {
            out.write(line);
            out.write('\n');
            out.flush();
            lines++;
        }
        if (LOG.isDebugEnabled())
            LOG.debug("Echoed {} lines to {}", lines, socket.getRemoteSocketAddress());
    }
}
