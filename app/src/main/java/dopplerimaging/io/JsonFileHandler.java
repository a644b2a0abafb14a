package dopplerimaging.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dopplerimaging.config.ObservationConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lectura y escritura de la configuración de observación en JSON.
 * <p>
 * Acepta ficheros parciales: los campos ausentes de {@link ObservationConfig}
 * se completan con {@link ObservationConfig#defaults()}.
 */
@Slf4j
public class JsonFileHandler {

    // El ObjectMapper es thread-safe y costoso de crear: se comparte.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Escribe la configuración en {@code path}, creando los directorios padre si hace falta.
     *
     * @throws IOException Si ocurre un error durante la escritura del archivo.
     */
    public void writeConfig(ObservationConfig config, Path path) throws IOException {
        log.info("Escribiendo configuración de observación en: {}", path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), config);
        } catch (IOException e) {
            log.error("Error fatal al escribir la configuración en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Lee una configuración completa o parcial.
     *
     * @throws IOException Si el archivo no existe o no es un JSON válido.
     */
    public ObservationConfig readConfig(Path path) throws IOException {
        log.info("Leyendo configuración de observación desde: {}", path.toAbsolutePath());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            if (root == null || !root.isObject()) {
                throw new IOException("La configuración debe ser un objeto JSON: " + path.toAbsolutePath());
            }
            ObservationConfig read = objectMapper.treeToValue(root, ObservationConfig.class);
            return withDefaults(read, root);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear la configuración desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    // Sólo se completan las claves ausentes; un valor explícito, aunque sea inválido,
    // llega tal cual a la validación del modelo.
    private static ObservationConfig withDefaults(ObservationConfig read, JsonNode root) {
        ObservationConfig defaults = ObservationConfig.defaults();
        ObservationConfig config = read;
        if (isAbsent(root, "star")) {
            config = config.withStar(defaults.getStar());
        }
        if (isAbsent(root, "radiation")) {
            config = config.withRadiation(defaults.getRadiation());
        }
        if (isAbsent(root, "numWavelengths")) {
            config = config.withNumWavelengths(defaults.getNumWavelengths());
        }
        if (isAbsent(root, "maxWavelength")) {
            config = config.withMaxWavelength(defaults.getMaxWavelength());
        }
        if (isAbsent(root, "phaseCount")) {
            config = config.withPhaseCount(defaults.getPhaseCount());
        }
        if (isAbsent(root, "cpuProcessorCount")) {
            config = config.withCpuProcessorCount(defaults.getCpuProcessorCount());
        }
        if (isAbsent(root, "visibilityModel")) {
            config = config.withVisibilityModel(defaults.getVisibilityModel());
        }
        if (isAbsent(root, "broadeningPolicy")) {
            config = config.withBroadeningPolicy(defaults.getBroadeningPolicy());
        }
        return config;
    }

    private static boolean isAbsent(JsonNode root, String field) {
        return !root.hasNonNull(field);
    }
}
