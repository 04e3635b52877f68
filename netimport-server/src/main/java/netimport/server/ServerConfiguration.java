package netimport.server;

import netimport.server.exec.CommandImportExecutor;
import netimport.spi.ImportExecutor;
import netimport.spring.boot.NetImportProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ServerConfiguration {

    @Bean
    public ImportExecutor commandImportExecutor(NetImportProperties props) {
        NetImportProperties.Server server = props.getServer();
        return new CommandImportExecutor(server.getCommand(), server.getCommandTimeout());
    }
}
