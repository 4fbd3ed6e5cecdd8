package minikv.commands.server;

import minikv.PubSub;
import minikv.ServerContext;
import minikv.commands.Args;
import minikv.commands.Command;
import minikv.db.Database;
import minikv.network.ClientHandler;

import java.util.List;

/**
 * INFO [section]: server, clients, memory, stats, pubsub, keyspace.
 */
public class InfoCommand implements Command {

    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String section = "all";
        if (args.size() > 1) {
            section = Args.str(args.get(1)).toLowerCase();
        }

        ServerContext context = client.getContext();
        StringBuilder info = new StringBuilder();
        boolean all = section.equals("all") || section.equals("default") || section.equals("everything");

        if (all || section.equals("server")) appendServer(context, info);
        if (all || section.equals("clients")) appendClients(context, info);
        if (all || section.equals("memory")) appendMemory(context, info);
        if (all || section.equals("stats")) appendStats(context, info);
        if (all || section.equals("pubsub")) appendPubSub(context, info);
        if (all || section.equals("keyspace")) appendKeyspace(context, info);

        client.sendBulkString(info.toString());
    }

    private void appendServer(ServerContext context, StringBuilder info) {
        info.append("# Server\r\n");
        info.append("minikv_version:").append(context.getVersion()).append("\r\n");
        info.append("os:").append(context.getOsName()).append(" ").append(context.getOsArch()).append("\r\n");
        info.append("java_version:").append(context.getJavaVersion()).append("\r\n");
        info.append("tcp_port:").append(context.getConfig().port).append("\r\n");
        info.append("uptime_in_seconds:").append(context.getUptime() / 1000).append("\r\n");
        info.append("\r\n");
    }

    private void appendClients(ServerContext context, StringBuilder info) {
        info.append("# Clients\r\n");
        info.append("connected_clients:").append(context.getActiveConnections().get()).append("\r\n");
        info.append("maxclients:").append(context.getConfig().maxClients).append("\r\n");
        info.append("\r\n");
    }

    private void appendMemory(ServerContext context, StringBuilder info) {
        info.append("# Memory\r\n");
        info.append("used_memory:").append(context.getUsedMemory()).append("\r\n");
        info.append("\r\n");
    }

    private void appendStats(ServerContext context, StringBuilder info) {
        Database db = context.getDatabase();
        info.append("# Stats\r\n");
        info.append("total_connections_received:").append(context.getTotalConnections().get()).append("\r\n");
        info.append("rejected_connections:").append(context.getRejectedConnections().get()).append("\r\n");
        info.append("total_commands_processed:").append(context.getTotalCommands().get()).append("\r\n");
        info.append("keyspace_hits:").append(db.getKeyspaceHits()).append("\r\n");
        info.append("keyspace_misses:").append(db.getKeyspaceMisses()).append("\r\n");
        info.append("expired_keys:").append(db.getExpiredKeys()).append("\r\n");
        info.append("\r\n");
    }

    private void appendPubSub(ServerContext context, StringBuilder info) {
        PubSub pubSub = context.getPubSub();
        info.append("# Pubsub\r\n");
        info.append("pubsub_channels:").append(pubSub.getChannelCount()).append("\r\n");
        info.append("pubsub_patterns:").append(pubSub.getPatternCount()).append("\r\n");
        info.append("\r\n");
    }

    private void appendKeyspace(ServerContext context, StringBuilder info) {
        info.append("# Keyspace\r\n");
        int size = context.getDatabase().size();
        if (size > 0) {
            info.append("db0:keys=").append(size).append("\r\n");
        }
        info.append("\r\n");
    }
}
