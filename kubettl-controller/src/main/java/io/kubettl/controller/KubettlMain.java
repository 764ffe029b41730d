/*
 * Copyright 2026 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.kubettl.controller;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.Collections;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.netflix.archaius.config.MapConfig;
import com.netflix.archaius.guice.ArchaiusModule;
import com.sampullara.cli.Args;
import com.sampullara.cli.Argument;
import io.kubettl.controller.ttl.TtlReportController;
import io.kubettl.runtime.connector.kubernetes.DefaultKubeApiFacade;
import io.kubettl.runtime.connector.kubernetes.KubeApiFacade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class KubettlMain {

    private static final Logger logger = LoggerFactory.getLogger(KubettlMain.class);

    @Argument(alias = "p", description = "Specify a configuration file", required = false)
    private static String propertiesFile;

    public static void main(String[] args) {
        try {
            Args.parse(KubettlMain.class, args);
        } catch (IllegalArgumentException e) {
            logger.error(e.getMessage());
            Args.usage(KubettlMain.class);
            System.exit(1);
        }

        try {
            Injector injector = Guice.createInjector(
                    new ArchaiusModule() {
                        @Override
                        protected void configureArchaius() {
                            bindApplicationConfigurationOverride().toInstance(loadPropertiesFile(propertiesFile));
                        }
                    },
                    new KubeClientModule(),
                    new TtlControllerModule()
            );

            TtlReportController controller = injector.getInstance(TtlReportController.class);
            KubeApiFacade kubeApiFacade = injector.getInstance(KubeApiFacade.class);
            CountDownLatch terminated = new CountDownLatch(1);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down");
                controller.shutdown();
                if (kubeApiFacade instanceof DefaultKubeApiFacade) {
                    ((DefaultKubeApiFacade) kubeApiFacade).deactivate();
                }
                terminated.countDown();
            }, "kubettl-shutdown"));

            controller.enterActiveMode();
            logger.info("kubettl controller started");
            terminated.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.error("Unexpected error: {}", e.getMessage(), e);
            System.exit(2);
        }
    }

    private static MapConfig loadPropertiesFile(String propertiesFile) {
        if (propertiesFile == null) {
            return MapConfig.from(Collections.emptyMap());
        }
        Properties properties = new Properties();
        try (Reader reader = new FileReader(new File(propertiesFile))) {
            properties.load(reader);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot load configuration file " + propertiesFile, e);
        }
        return MapConfig.from(properties);
    }
}
