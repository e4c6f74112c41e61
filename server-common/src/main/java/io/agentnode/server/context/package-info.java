@NullMarked
package io.agentnode.server.context;

import org.jspecify.annotations.NullMarked;
