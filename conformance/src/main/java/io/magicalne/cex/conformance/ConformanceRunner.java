package io.magicalne.cex.conformance;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.base.Preconditions;
import io.magicalne.cex.exception.NormalizationException;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

public class ConformanceRunner {

  /**
   *
   * @param args args[0]: yaml config file path
   */
  public static void main(String[] args) throws IOException, NormalizationException {
    Preconditions.checkArgument(args.length == 1, "usage: ConformanceRunner <job.yaml>");
    File yaml = new File(args[0]);
    ConformanceConfig config = readConfig(yaml);
    Path baseDir = yaml.getAbsoluteFile().getParentFile().toPath();
    ConformanceReport report = new ConformanceCheck().run(config, baseDir);
    System.exit(report.passed() ? 0 : 1);
  }

  static ConformanceConfig readConfig(File yaml) throws IOException {
    ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    return mapper.readValue(yaml, ConformanceConfig.class);
  }
}
